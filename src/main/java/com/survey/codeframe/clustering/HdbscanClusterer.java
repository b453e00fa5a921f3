package com.survey.codeframe.clustering;

import com.survey.codeframe.util.VectorMath;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;

/**
 * Density-based hierarchical clustering (HDBSCAN) over euclidean distance.
 * <p>
 * Steps: core distances from {@code minSamples}, minimum spanning tree of the mutual
 * reachability graph (Prim, distances computed on the fly so no n×n matrix is held),
 * single-linkage hierarchy, condensed tree pruned at {@code minClusterSize}, and
 * excess-of-mass selection. The root is never selected as a cluster.
 * <p>
 * Labels are deterministic for a given input order: cluster ids are assigned in order of
 * each cluster's lowest point index. Noise is labelled {@link #NOISE}.
 */
public class HdbscanClusterer {

    public static final int NOISE = -1;

    // 1/0 for duplicate points; keeps stability sums finite
    private static final double MIN_DISTANCE = 1e-12;

    private final int minClusterSize;
    private final int minSamples;

    public HdbscanClusterer(int minClusterSize, int minSamples) {
        if (minClusterSize < 2) {
            throw new IllegalArgumentException("minClusterSize must be at least 2");
        }
        if (minSamples < 1) {
            throw new IllegalArgumentException("minSamples must be at least 1");
        }
        this.minClusterSize = minClusterSize;
        this.minSamples = minSamples;
    }

    /**
     * @return one label per point, {@link #NOISE} or a cluster id in [0, clusterCount)
     */
    public int[] fit(List<float[]> points) {
        int n = points.size();
        int[] labels = new int[n];
        Arrays.fill(labels, NOISE);
        if (n < minClusterSize || n < 2) {
            return labels;
        }

        double[] core = coreDistances(points);
        MstEdge[] mst = minimumSpanningTree(points, core);
        SingleLinkage linkage = singleLinkage(mst, n);
        List<CondensedEdge> condensed = condense(linkage, n);
        List<Integer> selected = selectClusters(condensed, n);

        // gather members of each selected cluster, then number clusters by lowest member
        List<int[]> memberSets = new ArrayList<>();
        for (int cluster : selected) {
            memberSets.add(leavesOf(cluster, condensed, n));
        }
        memberSets.sort(Comparator.comparingInt(members -> members[0]));
        for (int id = 0; id < memberSets.size(); id++) {
            for (int point : memberSets.get(id)) {
                labels[point] = id;
            }
        }
        return labels;
    }

    public static int clusterCount(int[] labels) {
        int max = NOISE;
        for (int label : labels) {
            max = Math.max(max, label);
        }
        return max + 1;
    }

    private double[] coreDistances(List<float[]> points) {
        int n = points.size();
        // the point itself counts as its first neighbour
        int k = Math.min(minSamples - 1, n - 1);
        double[] core = new double[n];
        if (k == 0) {
            return core;
        }
        for (int i = 0; i < n; i++) {
            double[] nearest = new double[k];
            Arrays.fill(nearest, Double.POSITIVE_INFINITY);
            for (int j = 0; j < n; j++) {
                if (i == j) {
                    continue;
                }
                double d = VectorMath.euclideanDistance(points.get(i), points.get(j));
                if (d < nearest[k - 1]) {
                    int pos = k - 1;
                    while (pos > 0 && nearest[pos - 1] > d) {
                        nearest[pos] = nearest[pos - 1];
                        pos--;
                    }
                    nearest[pos] = d;
                }
            }
            core[i] = nearest[k - 1];
        }
        return core;
    }

    private MstEdge[] minimumSpanningTree(List<float[]> points, double[] core) {
        int n = points.size();
        boolean[] inTree = new boolean[n];
        double[] best = new double[n];
        int[] bestFrom = new int[n];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        Arrays.fill(bestFrom, -1);

        MstEdge[] edges = new MstEdge[n - 1];
        int current = 0;
        inTree[0] = true;
        for (int e = 0; e < n - 1; e++) {
            int next = -1;
            for (int j = 0; j < n; j++) {
                if (inTree[j]) {
                    continue;
                }
                double d = Math.max(VectorMath.euclideanDistance(points.get(current), points.get(j)),
                        Math.max(core[current], core[j]));
                if (d < best[j]) {
                    best[j] = d;
                    bestFrom[j] = current;
                }
                if (next == -1 || best[j] < best[next]) {
                    next = j;
                }
            }
            edges[e] = new MstEdge(bestFrom[next], next, best[next]);
            inTree[next] = true;
            current = next;
        }

        Arrays.sort(edges, Comparator.comparingDouble(MstEdge::weight)
                .thenComparingInt(edge -> Math.min(edge.a(), edge.b()))
                .thenComparingInt(edge -> Math.max(edge.a(), edge.b())));
        return edges;
    }

    private SingleLinkage singleLinkage(MstEdge[] edges, int n) {
        int total = 2 * n - 1;
        int[] parent = new int[total];
        int[] size = new int[total];
        for (int i = 0; i < total; i++) {
            parent[i] = i;
            size[i] = i < n ? 1 : 0;
        }

        int[] left = new int[n - 1];
        int[] right = new int[n - 1];
        double[] distance = new double[n - 1];
        int next = n;
        for (MstEdge edge : edges) {
            int a = find(parent, edge.a());
            int b = find(parent, edge.b());
            int slot = next - n;
            left[slot] = a;
            right[slot] = b;
            distance[slot] = edge.weight();
            size[next] = size[a] + size[b];
            parent[a] = next;
            parent[b] = next;
            next++;
        }
        return new SingleLinkage(left, right, distance, size);
    }

    private static int find(int[] parent, int x) {
        int root = x;
        while (parent[root] != root) {
            root = parent[root];
        }
        while (parent[x] != root) {
            int up = parent[x];
            parent[x] = root;
            x = up;
        }
        return root;
    }

    private List<CondensedEdge> condense(SingleLinkage linkage, int n) {
        int root = 2 * n - 2;
        int[] relabel = new int[2 * n - 1];
        boolean[] ignore = new boolean[2 * n - 1];
        relabel[root] = n;
        int nextLabel = n + 1;

        List<CondensedEdge> result = new ArrayList<>();
        Deque<Integer> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            int node = queue.poll();
            if (node < n || ignore[node]) {
                continue;
            }
            int slot = node - n;
            int left = linkage.left()[slot];
            int right = linkage.right()[slot];
            double lambda = 1.0 / Math.max(linkage.distance()[slot], MIN_DISTANCE);
            int leftCount = linkage.size()[left];
            int rightCount = linkage.size()[right];
            int parentLabel = relabel[node];

            if (leftCount >= minClusterSize && rightCount >= minClusterSize) {
                relabel[left] = nextLabel++;
                result.add(new CondensedEdge(parentLabel, relabel[left], lambda, leftCount));
                relabel[right] = nextLabel++;
                result.add(new CondensedEdge(parentLabel, relabel[right], lambda, rightCount));
            } else if (leftCount < minClusterSize && rightCount < minClusterSize) {
                fallOut(left, parentLabel, lambda, linkage, n, ignore, result);
                fallOut(right, parentLabel, lambda, linkage, n, ignore, result);
            } else if (leftCount < minClusterSize) {
                relabel[right] = parentLabel;
                fallOut(left, parentLabel, lambda, linkage, n, ignore, result);
            } else {
                relabel[left] = parentLabel;
                fallOut(right, parentLabel, lambda, linkage, n, ignore, result);
            }
            queue.add(left);
            queue.add(right);
        }
        return result;
    }

    private void fallOut(int node, int parentLabel, double lambda, SingleLinkage linkage, int n,
                         boolean[] ignore, List<CondensedEdge> result) {
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            if (current < n) {
                result.add(new CondensedEdge(parentLabel, current, lambda, 1));
            } else {
                ignore[current] = true;
                stack.push(linkage.right()[current - n]);
                stack.push(linkage.left()[current - n]);
            }
        }
    }

    private List<Integer> selectClusters(List<CondensedEdge> condensed, int n) {
        int maxLabel = n;
        for (CondensedEdge edge : condensed) {
            maxLabel = Math.max(maxLabel, Math.max(edge.parent(), edge.child()));
        }
        int clusterSlots = maxLabel - n + 1;

        double[] birth = new double[clusterSlots];
        for (CondensedEdge edge : condensed) {
            if (edge.child() >= n) {
                birth[edge.child() - n] = edge.lambda();
            }
        }
        double[] stability = new double[clusterSlots];
        List<List<Integer>> children = new ArrayList<>();
        for (int i = 0; i < clusterSlots; i++) {
            children.add(new ArrayList<>());
        }
        for (CondensedEdge edge : condensed) {
            int p = edge.parent() - n;
            stability[p] += (edge.lambda() - birth[p]) * edge.childSize();
            if (edge.child() >= n) {
                children.get(p).add(edge.child() - n);
            }
        }

        boolean[] isCluster = new boolean[clusterSlots];
        Arrays.fill(isCluster, true);
        isCluster[0] = false;

        // children always carry larger labels than their parent, so descending order is bottom-up
        for (int c = clusterSlots - 1; c >= 1; c--) {
            double childStability = 0.0;
            for (int child : children.get(c)) {
                childStability += stability[child];
            }
            if (childStability > stability[c]) {
                isCluster[c] = false;
                stability[c] = childStability;
            } else {
                Deque<Integer> stack = new ArrayDeque<>(children.get(c));
                while (!stack.isEmpty()) {
                    int d = stack.pop();
                    isCluster[d] = false;
                    stack.addAll(children.get(d));
                }
            }
        }

        List<Integer> selected = new ArrayList<>();
        for (int c = 1; c < clusterSlots; c++) {
            if (isCluster[c]) {
                selected.add(c + n);
            }
        }
        return selected;
    }

    private int[] leavesOf(int cluster, List<CondensedEdge> condensed, int n) {
        List<Integer> leaves = new ArrayList<>();
        Deque<Integer> stack = new ArrayDeque<>();
        stack.push(cluster);
        while (!stack.isEmpty()) {
            int current = stack.pop();
            for (CondensedEdge edge : condensed) {
                if (edge.parent() != current) {
                    continue;
                }
                if (edge.child() < n) {
                    leaves.add(edge.child());
                } else {
                    stack.push(edge.child());
                }
            }
        }
        return leaves.stream().mapToInt(Integer::intValue).sorted().toArray();
    }

    private record MstEdge(int a, int b, double weight) {}

    private record SingleLinkage(int[] left, int[] right, double[] distance, int[] size) {}

    private record CondensedEdge(int parent, int child, double lambda, int childSize) {}
}
