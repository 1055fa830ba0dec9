package xregrid.domain.exception;

/**
 * Fallo de una tarea paralela (chunk de aplicación o partición de pesos).
 * Lleva el índice del chunk de origen y la causa subyacente.
 */
public class ChunkFailure extends RegridException {

    private final int chunkIndex;

    public ChunkFailure(int chunkIndex, Throwable cause) {
        super(String.format("Fallo en el chunk %d: %s", chunkIndex,
                cause == null ? "causa desconocida" : cause.getMessage()), cause);
        this.chunkIndex = chunkIndex;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }
}
