package xregrid.parallel;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;

/**
 * Contexto de ejecución explícito para las tareas del orquestador.
 * <p>
 * Su ciclo de vida (creación, envío, cierre) pertenece a quien lo crea, nunca al motor.
 */
public interface ExecutionContext {

    <T> Future<T> submit(Callable<T> task);

    /**
     * Número de tareas que pueden ejecutarse a la vez.
     */
    int parallelism();

    /**
     * Contexto que ejecuta cada tarea en el hilo que la envía. Útil para el modo secuencial.
     */
    static ExecutionContext sameThread() {
        return new ExecutionContext() {
            @Override
            public <T> Future<T> submit(Callable<T> task) {
                FutureTask<T> future = new FutureTask<>(task);
                future.run();
                return future;
            }

            @Override
            public int parallelism() {
                return 1;
            }
        };
    }
}
