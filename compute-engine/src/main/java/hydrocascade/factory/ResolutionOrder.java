package hydrocascade.factory;

import hydrocascade.domain.cascade.ReservoirLinks;
import hydrocascade.domain.exception.InvalidTopologyException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;

/**
 * Orden topológico de resolución de una cascada (algoritmo de Kahn).
 * <p>
 * Cada embalse depende de los embalses que declara aguas arriba. Entre embalses listos a la
 * vez se respeta el orden de declaración, de modo que el resultado es determinista.
 */
final class ResolutionOrder {

    private ResolutionOrder() {}

    /**
     * @param declared Identificadores en orden de declaración.
     * @param links    Enlaces ya validados (todos los ids existen).
     * @return Identificadores ordenados de aguas arriba a aguas abajo.
     * @throws InvalidTopologyException si los enlaces aguas arriba forman un ciclo.
     */
    static List<String> compute(String cascadeId, List<String> declared, Map<String, ReservoirLinks> links) {
        int n = declared.size();
        Map<String, Integer> indexOf = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++) {
            indexOf.put(declared.get(i), i);
        }

        // 1. Aristas aguas arriba → aguas abajo y grados de entrada
        List<List<Integer>> dependents = new ArrayList<>(n);
        for (int i = 0; i < n; i++) dependents.add(new ArrayList<>());
        int[] inDegree = new int[n];
        for (int i = 0; i < n; i++) {
            for (String upstreamId : links.get(declared.get(i)).upstream()) {
                dependents.get(indexOf.get(upstreamId)).add(i);
                inDegree[i]++;
            }
        }

        // 2. Cola de listos ordenada por posición de declaración
        PriorityQueue<Integer> ready = new PriorityQueue<>();
        for (int i = 0; i < n; i++) {
            if (inDegree[i] == 0) ready.add(i);
        }

        // 3. Kahn
        List<String> order = new ArrayList<>(n);
        while (!ready.isEmpty()) {
            int current = ready.poll();
            order.add(declared.get(current));
            for (int dependent : dependents.get(current)) {
                if (--inDegree[dependent] == 0) ready.add(dependent);
            }
        }

        if (order.size() != n) {
            List<String> blocked = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if (inDegree[i] > 0) blocked.add(declared.get(i));
            }
            throw new InvalidTopologyException(
                    "Cascade " + cascadeId + " contains an upstream cycle involving " + blocked);
        }
        return order;
    }
}
