package xregrid.cache;

import xregrid.domain.operator.RegridOperator;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Caché en memoria del proceso. Los operadores son inmutables, así que se guardan tal cual.
 */
public class InMemoryOperatorCache implements OperatorCache {

    private final Map<String, RegridOperator> operators = new ConcurrentHashMap<>();

    @Override
    public Optional<RegridOperator> load(String key) {
        return Optional.ofNullable(operators.get(key));
    }

    @Override
    public void store(String key, RegridOperator operator) {
        operators.put(key, operator);
    }

    public int size() {
        return operators.size();
    }
}
