package run.telo.kernel.runtime;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Stable topological sort placing every kind-defining resource ahead of the resources of that kind.
 */
public final class DependencyOrderer {
    private DependencyOrderer() {}

    public static List<Resource> order(List<Resource> resources) {
        int size = resources.size();
        var definers = definerIndex(resources);

        List<Set<Integer>> dependents = new ArrayList<>(size);
        int[] inDegree = new int[size];
        for (int i = 0; i < size; i++) {
            dependents.add(new LinkedHashSet<>());
        }
        for (int i = 0; i < size; i++) {
            var kind = resources.get(i).kind();
            for (int definer : definers.getOrDefault(kind, List.of())) {
                if (definer != i && dependents.get(definer).add(i)) {
                    inDegree[i]++;
                }
            }
        }

        var ready = new PriorityQueue<Integer>();
        for (int i = 0; i < size; i++) {
            if (inDegree[i] == 0) {
                ready.add(i);
            }
        }
        var ordered = new ArrayList<Resource>(size);
        while (!ready.isEmpty()) {
            int next = ready.poll();
            ordered.add(resources.get(next));
            for (int dependent : dependents.get(next)) {
                if (--inDegree[dependent] == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (ordered.size() != size) {
            var cycle = new ArrayList<String>();
            for (int i = 0; i < size; i++) {
                if (inDegree[i] > 0) {
                    cycle.add(resources.get(i).id().toString());
                }
            }
            throw new KernelException(
                ErrorCode.ERR_DEPENDENCY_CYCLE,
                "Resource dependency cycle detected among: " + String.join(", ", cycle)
            );
        }
        return ordered;
    }

    private static List<String> definedKinds(Resource resource) {
        var name = resource.name();
        var module = resource.module();
        if (module == null || module.isBlank()) {
            return List.of(name);
        }
        return List.of(name, module + "." + name);
    }

    private static Map<String, List<Integer>> definerIndex(List<Resource> resources) {
        var index = new HashMap<String, List<Integer>>();
        for (int i = 0; i < resources.size(); i++) {
            for (var kind : definedKinds(resources.get(i))) {
                index.computeIfAbsent(kind, k -> new ArrayList<>()).add(i);
            }
        }
        return index;
    }
}
