package xregrid.service;

import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xregrid.apply.SparseApplicationEngine;
import xregrid.apply.SpatialLayout;
import xregrid.cache.FileOperatorCache;
import xregrid.cache.GridFingerprinter;
import xregrid.cache.InMemoryOperatorCache;
import xregrid.cache.OperatorCache;
import xregrid.config.RegridConfig;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.exception.IncompatibleCacheError;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.Extrapolation;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;
import xregrid.grid.GridNormalizer;
import xregrid.parallel.ChunkOrchestrator;
import xregrid.parallel.ExecutionContext;
import xregrid.weights.WeightBackend;
import xregrid.weights.WeightGenerationEngine;
import xregrid.weights.impl.GeometricWeightBackend;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * API del núcleo: normalizar mallas, obtener (generar o cargar) operadores y aplicarlos.
 * <p>
 * Con un {@link ChunkOrchestrator} la generación de pesos se reparte en particiones de
 * filas y la aplicación en chunks; sin él todo se ejecuta en el hilo llamante.
 */
@Slf4j
public class RegridService {

    @Getter
    private final GridNormalizer normalizer;
    private final WeightGenerationEngine weightEngine;
    private final SparseApplicationEngine applicationEngine;
    private final OperatorCache cache;
    private final ChunkOrchestrator orchestrator;
    private final int partitionCount;
    private final int chunkSize;

    @Builder
    public RegridService(GridNormalizer normalizer,
                         WeightGenerationEngine weightEngine,
                         SparseApplicationEngine applicationEngine,
                         OperatorCache cache,
                         ChunkOrchestrator orchestrator,
                         int partitionCount,
                         int chunkSize) {
        this.normalizer = normalizer == null ? new GridNormalizer() : normalizer;
        this.weightEngine = Objects.requireNonNull(weightEngine, "El motor de pesos no puede ser nulo.");
        this.applicationEngine = applicationEngine == null ? new SparseApplicationEngine() : applicationEngine;
        this.cache = cache;
        this.orchestrator = orchestrator;
        this.partitionCount = Math.max(partitionCount, 1);
        this.chunkSize = chunkSize > 0 ? chunkSize : 16;
    }

    /**
     * Servicio de producción a partir de una configuración.
     *
     * @param context Contexto de ejecución para el modo paralelo, o {@code null} para el secuencial.
     */
    public static RegridService create(RegridConfig config, ExecutionContext context) {
        WeightBackend backend = new GeometricWeightBackend(config.effectivePatchNeighbours());
        WeightGenerationEngine weightEngine = new WeightGenerationEngine(backend);
        SparseApplicationEngine applicationEngine = new SparseApplicationEngine();
        return RegridService.builder()
                .weightEngine(weightEngine)
                .applicationEngine(applicationEngine)
                .cache(cacheFor(config))
                .orchestrator(context == null ? null : new ChunkOrchestrator(context, applicationEngine, weightEngine))
                .partitionCount(config.parallelWeights() ? config.effectivePartitionCount() : 1)
                .chunkSize(config.effectiveChunkSize())
                .build();
    }

    static OperatorCache cacheFor(RegridConfig config) {
        if (config.weightsFile() != null) {
            return FileOperatorCache.forFile(Path.of(config.weightsFile()));
        }
        if (config.cacheDirectory() != null) {
            return new FileOperatorCache(Path.of(config.cacheDirectory()));
        }
        return new InMemoryOperatorCache();
    }

    // --- NORMALIZACIÓN ---

    public CanonicalGrid normalize(GridSource source) {
        return normalizer.normalize(source);
    }

    public CanonicalGrid normalize(GridSource source, RegridMethod method) {
        return normalizer.normalize(source, method);
    }

    // --- OPERADORES ---

    public RegridOperator generateOrLoad(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                         boolean periodic, String cacheKey) {
        return generateOrLoad(source, target, method, periodic, Extrapolation.DISABLED, cacheKey);
    }

    /**
     * Devuelve el operador persistido bajo {@code cacheKey} si su huella coincide con la de la
     * petición; si no, lo genera y lo guarda.
     *
     * @param cacheKey Clave de caché, o {@code null} para usar la propia huella.
     * @throws IncompatibleCacheError si el operador persistido se generó con otra extrapolación.
     */
    public RegridOperator generateOrLoad(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                         boolean periodic, Extrapolation extrapolation, String cacheKey) {
        Extrapolation extrap = extrapolation == null ? Extrapolation.DISABLED : extrapolation;
        String fingerprint = GridFingerprinter.fingerprint(source, target, method, periodic, extrap);
        String key = cacheKey == null ? fingerprint : cacheKey;
        if (cache != null) {
            Optional<RegridOperator> cached = cache.load(key);
            if (cached.isPresent()) {
                RegridOperator operator = cached.get();
                if (fingerprint.equals(operator.getFingerprint())) {
                    log.info("Operador {} reutilizado desde caché (nnz={}).", method, operator.nnz());
                    return operator;
                }
                if (!extrap.equals(operator.getExtrapolation())) {
                    throw new IncompatibleCacheError(String.format(
                            "La extrapolación pedida (%s) no coincide con la del operador persistido bajo '%s' (%s).",
                            extrap.describe(), key, operator.getExtrapolation().describe()));
                }
                log.warn("El operador en caché bajo '{}' procede de otras mallas o de otro método. Se regenera.", key);
            }
        }
        return generateAndStore(source, target, method, periodic, extrap, key, fingerprint);
    }

    public RegridOperator generate(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                   boolean periodic, String cacheKey) {
        return generate(source, target, method, periodic, Extrapolation.DISABLED, cacheKey);
    }

    /**
     * Genera siempre un operador nuevo y, si hay caché, lo guarda (sobrescribiendo).
     */
    public RegridOperator generate(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                   boolean periodic, Extrapolation extrapolation, String cacheKey) {
        Extrapolation extrap = extrapolation == null ? Extrapolation.DISABLED : extrapolation;
        String fingerprint = GridFingerprinter.fingerprint(source, target, method, periodic, extrap);
        return generateAndStore(source, target, method, periodic, extrap,
                cacheKey == null ? fingerprint : cacheKey, fingerprint);
    }

    private RegridOperator generateAndStore(CanonicalGrid source, CanonicalGrid target, RegridMethod method,
                                            boolean periodic, Extrapolation extrapolation, String key,
                                            String fingerprint) {
        RegridOperator operator;
        if (orchestrator != null && partitionCount > 1) {
            operator = orchestrator.generateParallel(source, target, method, periodic, partitionCount, extrapolation);
        } else {
            operator = weightEngine.generate(source, target, method, periodic, extrapolation);
        }
        operator = operator.withFingerprint(fingerprint);
        if (cache != null) {
            cache.store(key, operator);
        }
        return operator;
    }

    // --- APLICACIÓN ---

    public DataVariable apply(RegridOperator operator, DataVariable data, boolean skipNa) {
        return applicationEngine.apply(operator, data, skipNa);
    }

    public DataVariable apply(RegridOperator operator, DataVariable data, SpatialLayout layout, boolean skipNa) {
        if (orchestrator != null) {
            return orchestrator.applyParallel(operator, data, layout, skipNa, chunkSize);
        }
        return applicationEngine.apply(operator, data, layout, skipNa);
    }
}
