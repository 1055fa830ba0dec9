package xregrid.grid.matcher;

import xregrid.domain.dataset.DataVariable;
import xregrid.domain.dataset.GridDataset;

import java.util.List;
import java.util.Optional;

/**
 * Localiza la máscara de celdas de un dataset: una variable {@code mask} sobre las dimensiones
 * espaciales, o la que nombre el atributo {@code mask} de alguna coordenada.
 * Un valor 0 (o NaN) marca la celda como excluida.
 */
final class MaskResolver {

    private MaskResolver() {
    }

    static boolean[] resolve(GridDataset ds, List<String> spatialDims, List<DataVariable> coordinates) {
        Optional<DataVariable> maskVar = coordinates.stream()
                .map(c -> c.stringAttribute("mask"))
                .flatMap(Optional::stream)
                .map(ds::variable)
                .flatMap(Optional::stream)
                .findFirst()
                .or(() -> ds.variable("mask"));
        if (maskVar.isEmpty()) {
            return null;
        }
        DataVariable mask = maskVar.get();
        double[] values;
        if (mask.getDims().equals(spatialDims)) {
            values = mask.getData();
        } else if (spatialDims.size() == 2 && mask.getDims().equals(List.of(spatialDims.get(1), spatialDims.get(0)))) {
            int[] shape = mask.getShape();
            double[] raw = mask.getData();
            values = new double[raw.length];
            for (int a = 0; a < shape[0]; a++) {
                for (int b = 0; b < shape[1]; b++) {
                    values[b * shape[0] + a] = raw[a * shape[1] + b];
                }
            }
        } else {
            throw new IllegalArgumentException(String.format(
                    "La máscara '%s' tiene dimensiones %s incompatibles con la malla %s.",
                    mask.getName(), mask.getDims(), spatialDims));
        }
        boolean[] excluded = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            excluded[i] = Double.isNaN(values[i]) || values[i] == 0.0;
        }
        return excluded;
    }
}
