package com.pulsebrief.insights.anomaly;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Isolation forest (Liu, Ting and Zhou). Seeded, so identical training data gives
 * identical scores. Scores near 1 are easy to isolate; typical points sit below 0.5.
 */
public final class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649d;

    private final int treeCount;
    private final int sampleSize;
    private final long seed;
    private final List<Node> trees = new ArrayList<>();
    private int effectiveSampleSize;

    public IsolationForest(int treeCount, int sampleSize, long seed) {
        if (treeCount <= 0 || sampleSize <= 1) {
            throw new IllegalArgumentException("treeCount must be positive and sampleSize above one");
        }
        this.treeCount = treeCount;
        this.sampleSize = sampleSize;
        this.seed = seed;
    }

    public IsolationForest fit(double[][] rows) {
        if (rows.length < 2) {
            throw new IllegalArgumentException("need at least two rows to build an isolation forest");
        }
        trees.clear();
        Random random = new Random(seed);
        effectiveSampleSize = Math.min(sampleSize, rows.length);
        int heightLimit = (int) Math.ceil(Math.log(effectiveSampleSize) / Math.log(2));
        for (int t = 0; t < treeCount; t++) {
            double[][] sample = sample(rows, effectiveSampleSize, random);
            trees.add(build(sample, 0, heightLimit, random));
        }
        return this;
    }

    public double score(double[] row) {
        if (trees.isEmpty()) {
            throw new IllegalStateException("forest has not been fitted");
        }
        double total = 0d;
        for (Node tree : trees) {
            total += pathLength(tree, row, 0);
        }
        double meanPath = total / trees.size();
        return Math.pow(2d, -meanPath / averagePathLength(effectiveSampleSize));
    }

    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0d;
        }
        if (n == 2) {
            return 1d;
        }
        double harmonic = Math.log(n - 1d) + EULER_GAMMA;
        return 2d * harmonic - 2d * (n - 1d) / n;
    }

    private double[][] sample(double[][] rows, int size, Random random) {
        if (size >= rows.length) {
            return rows.clone();
        }
        int[] indices = new int[rows.length];
        for (int i = 0; i < indices.length; i++) {
            indices[i] = i;
        }
        double[][] sample = new double[size][];
        for (int i = 0; i < size; i++) {
            int pick = i + random.nextInt(rows.length - i);
            int tmp = indices[i];
            indices[i] = indices[pick];
            indices[pick] = tmp;
            sample[i] = rows[indices[i]];
        }
        return sample;
    }

    private Node build(double[][] rows, int depth, int heightLimit, Random random) {
        if (depth >= heightLimit || rows.length <= 1) {
            return Node.leaf(rows.length);
        }
        int features = rows[0].length;
        List<Integer> splittable = new ArrayList<>();
        for (int f = 0; f < features; f++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : rows) {
                min = Math.min(min, row[f]);
                max = Math.max(max, row[f]);
            }
            if (max > min) {
                splittable.add(f);
            }
        }
        if (splittable.isEmpty()) {
            return Node.leaf(rows.length);
        }
        int feature = splittable.get(random.nextInt(splittable.size()));
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double[] row : rows) {
            min = Math.min(min, row[feature]);
            max = Math.max(max, row[feature]);
        }
        double split = min + random.nextDouble() * (max - min);
        List<double[]> left = new ArrayList<>();
        List<double[]> right = new ArrayList<>();
        for (double[] row : rows) {
            if (row[feature] < split) {
                left.add(row);
            } else {
                right.add(row);
            }
        }
        return Node.split(feature, split,
                build(left.toArray(new double[0][]), depth + 1, heightLimit, random),
                build(right.toArray(new double[0][]), depth + 1, heightLimit, random));
    }

    private double pathLength(Node node, double[] row, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size());
        }
        Node next = row[node.feature()] < node.threshold() ? node.left() : node.right();
        return pathLength(next, row, depth + 1);
    }

    private record Node(int feature, double threshold, Node left, Node right, int size) {

        static Node leaf(int size) {
            return new Node(-1, 0d, null, null, size);
        }

        static Node split(int feature, double threshold, Node left, Node right) {
            return new Node(feature, threshold, left, right, 0);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
