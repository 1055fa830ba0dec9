package xregrid.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xregrid.apply.SparseApplicationEngine;
import xregrid.apply.SpatialLayout;
import xregrid.cache.FileOperatorCache;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.operator.RegridOperator;

import java.nio.file.Path;
import java.util.List;

/**
 * Aplica un operador persistido sin necesidad de las mallas que lo generaron.
 * <p>
 * Útil cuando los pesos se calcularon en otra máquina o en una ejecución anterior: basta con
 * el fichero JSON y datos cuya forma espacial coincida con la del operador.
 */
@Slf4j
public class WeightFileApplier {

    @Getter
    private final RegridOperator operator;
    private final SparseApplicationEngine engine = new SparseApplicationEngine();

    public WeightFileApplier(Path weightsFile) {
        this.operator = FileOperatorCache.forFile(weightsFile).read(weightsFile).toOperator();
        log.info("Pesos cargados desde {}: {}", weightsFile, operator);
    }

    /**
     * Aplica el operador tomando las últimas dimensiones de {@code data} como espaciales.
     */
    public DataVariable apply(DataVariable data, boolean skipNa) {
        return engine.apply(operator, data, skipNa);
    }

    public DataVariable apply(DataVariable data, List<String> sourceDims, List<String> targetDims, boolean skipNa) {
        return engine.apply(operator, data, new SpatialLayout(sourceDims, targetDims), skipNa);
    }
}
