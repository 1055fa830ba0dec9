package xregrid.service;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import xregrid.apply.SpatialLayout;
import xregrid.config.RegridConfig;
import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;
import xregrid.domain.dataset.GridSource;
import xregrid.domain.grid.CanonicalGrid;
import xregrid.domain.operator.RegridMethod;
import xregrid.domain.operator.RegridOperator;
import xregrid.grid.PeriodicityDetector;
import xregrid.metadata.MetadataPropagator;
import xregrid.parallel.LocalExecutionContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Fachada de alto nivel: normaliza las dos mallas, obtiene el operador (generándolo o
 * reutilizándolo) y regridea variables o datasets completos con sus metadatos.
 * <p>
 * Si la configuración pide varios workers y no se inyecta un servicio, el regridder crea su
 * propio {@link LocalExecutionContext} y lo cierra en {@link #close()}.
 */
@Slf4j
public class Regridder implements AutoCloseable {

    private static final Set<String> TOPOLOGY_ROLES = Set.of("mesh_topology", "face_node_connectivity");

    @Getter
    private final CanonicalGrid sourceGrid;
    @Getter
    private final CanonicalGrid targetGrid;
    @Getter
    private final RegridOperator operator;
    @Getter
    private final RegridConfig config;
    private final RegridService service;
    private final LocalExecutionContext ownedContext;
    private final MetadataPropagator propagator = new MetadataPropagator();

    public Regridder(GridSource source, GridSource target, RegridConfig config) {
        this(source, target, config, null);
    }

    public Regridder(GridSource source, GridSource target, RegridConfig config, RegridService service) {
        this.config = config == null ? RegridConfig.getDefault() : config;
        LocalExecutionContext context = null;
        if (service == null && this.config.isParallel()) {
            context = new LocalExecutionContext(this.config.workerCount());
        }
        this.ownedContext = context;
        try {
            this.service = service != null ? service : RegridService.create(this.config, context);
            RegridMethod method = this.config.method();
            CanonicalGrid src = this.service.normalize(Objects.requireNonNull(source, "La malla origen no puede ser nula."), method);
            this.targetGrid = this.service.normalize(Objects.requireNonNull(target, "La malla destino no puede ser nula."), method);
            boolean periodic = PeriodicityDetector.resolve(this.config.periodic(), src);
            this.sourceGrid = src.withPeriodic(periodic);

            long startTime = System.currentTimeMillis();
            this.operator = this.config.reuseWeights()
                    ? this.service.generateOrLoad(sourceGrid, targetGrid, method, periodic, this.config.extrapolation(), null)
                    : this.service.generate(sourceGrid, targetGrid, method, periodic, this.config.extrapolation(), null);
            log.info("Regridder listo: {} -> {} con {} en {} ms.", sourceGrid, targetGrid, operator,
                    System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            if (context != null) {
                context.close();
            }
            throw e;
        }
    }

    // --- REGRIDDING ---

    /**
     * Regridea una variable y devuelve solo la variable, con los atributos de enlace espacial
     * actualizados y la línea de procedencia en {@code history}.
     */
    public DataVariable regridVariable(DataVariable data) {
        DataVariable result = service.apply(operator, data, SpatialLayout.of(sourceGrid, targetGrid), config.skipNa());
        result = propagator.link(result, targetGrid);
        return result.withAttributes(propagator.appendHistory(result.getAttributes(),
                MetadataPropagator.provenance(operator.getMethod(), operator.getExtrapolation())));
    }

    /**
     * Regridea una variable y la devuelve junto con las coordenadas de la malla destino.
     */
    public GridDataset regrid(DataVariable data) {
        return propagator.propagate(regridVariable(data), targetGrid);
    }

    /**
     * Regridea todas las variables que contienen las dimensiones espaciales de origen y
     * conserva las que no tienen ninguna. Las coordenadas auxiliares sobre la malla (por
     * ejemplo una altitud {@code (lat, lon)}) se regridean y siguen siendo coordenadas. Las
     * coordenadas, límites y topología de la malla origen se sustituyen por los de la malla
     * destino.
     */
    public GridDataset regrid(GridDataset dataset) {
        List<String> spatialDims = sourceGrid.getDescriptor().spatialDims();
        Set<String> gridVariables = gridSupportVariables(dataset);
        gridVariables.add(sourceGrid.getDescriptor().latName());
        gridVariables.add(sourceGrid.getDescriptor().lonName());
        List<DataVariable> out = new ArrayList<>();
        int regridded = 0;
        for (DataVariable variable : dataset.variables()) {
            if (gridVariables.contains(variable.getName())) {
                continue;
            }
            boolean hasAll = variable.getDims().containsAll(spatialDims);
            boolean hasAny = spatialDims.stream().anyMatch(variable::hasDim);
            if (hasAll) {
                out.add(variable.isCoordinate() ? regridCoordinate(variable) : regridVariable(variable));
                regridded++;
            } else if (!hasAny) {
                out.add(variable);
            }
        }
        List<DataVariable> withCoords = propagator.withTargetCoordinates(out, targetGrid);
        log.info("Dataset regriddeado: {} variables transformadas, {} conservadas.", regridded, out.size() - regridded);
        return new GridDataset(withCoords, propagator.appendHistory(dataset.getAttributes(),
                "Regridded Dataset using xregrid "
                        + MetadataPropagator.settings(operator.getMethod(), operator.getExtrapolation())));
    }

    private DataVariable regridCoordinate(DataVariable coordinate) {
        DataVariable result = service.apply(operator, coordinate, SpatialLayout.of(sourceGrid, targetGrid), config.skipNa());
        return propagator.link(result, targetGrid).toBuilder().coordinate(true).build();
    }

    /**
     * Variables que describen la malla origen (límites, máscara, topología) y no son datos.
     */
    private static Set<String> gridSupportVariables(GridDataset dataset) {
        Set<String> names = new HashSet<>();
        for (DataVariable variable : dataset.variables()) {
            variable.stringAttribute("bounds").ifPresent(names::add);
            variable.stringAttribute("mask").ifPresent(names::add);
            if (variable.stringAttribute("cf_role").map(TOPOLOGY_ROLES::contains).orElse(false)) {
                names.add(variable.getName());
            }
        }
        names.add("mask");
        return names;
    }

    // --- DIAGNÓSTICO ---

    public QualityReport qualityReport() {
        return QualityReport.of(operator);
    }

    public boolean isPeriodic() {
        return sourceGrid.isPeriodic();
    }

    @Override
    public void close() {
        if (ownedContext != null) {
            ownedContext.close();
        }
    }

    @Override
    public String toString() {
        QualityReport report = qualityReport();
        return String.format("Regridder[method=%s, periodic=%s, source=%s, target=%s, nnz=%d, unmapped=%d]",
                operator.getMethod(), sourceGrid.isPeriodic(), sourceGrid.getKind(), targetGrid.getKind(),
                operator.nnz(), report.unmappedCount());
    }
}
