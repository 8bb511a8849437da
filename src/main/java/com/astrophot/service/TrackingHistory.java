package com.astrophot.service;

import com.astrophot.model.Position;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Ventana deslizante de posiciones, velocidades y confianzas recientes.
 * Cada sesión tiene la suya; no se comparte entre sesiones.
 */
public class TrackingHistory {

    private static final int RADIUS_WINDOW = 5;

    private final int capacity;
    private final Deque<Position> positions = new ArrayDeque<>();
    private final Deque<Double> confidences = new ArrayDeque<>();
    private final Deque<double[]> velocities = new ArrayDeque<>();

    public TrackingHistory() {
        this(5);
    }

    public TrackingHistory(int capacity) {
        if (capacity < 2) throw new IllegalArgumentException("capacity < 2");
        this.capacity = capacity;
    }

    public void push(Position position, double confidence) {
        Position previous = positions.peekLast();
        positions.addLast(position);
        confidences.addLast(confidence);
        if (previous != null) {
            velocities.addLast(new double[] { position.x - previous.x, position.y - previous.y });
        }
        while (positions.size() > capacity) {
            positions.removeFirst();
            confidences.removeFirst();
        }
        while (velocities.size() > capacity) velocities.removeFirst();
    }

    public Position predict(Position expected) {
        if (positions.size() < 2 || velocities.isEmpty()) return expected;

        int n = velocities.size();
        double sumW = 0, vx = 0, vy = 0;
        int i = 0;
        // Las velocidades más recientes pesan más: (i+1)/n
        for (double[] v : velocities) {
            double w = (i + 1) / (double) n;
            vx += v[0] * w;
            vy += v[1] * w;
            sumW += w;
            i++;
        }
        return expected.plus(vx / sumW, vy / sumW);
    }

    public double adaptiveRadius(double base) {
        if (positions.size() < 3) return base;

        List<Position> recent = new ArrayList<>(positions);
        recent = recent.subList(Math.max(0, recent.size() - RADIUS_WINDOW), recent.size());
        double[] xs = recent.stream().mapToDouble(p -> p.x).toArray();
        double[] ys = recent.stream().mapToDouble(p -> p.y).toArray();
        double sx = SigmaClippedStats.std(xs, SigmaClippedStats.mean(xs));
        double sy = SigmaClippedStats.std(ys, SigmaClippedStats.mean(ys));
        double variance = Math.sqrt(sx * sx + sy * sy);

        return Math.max(base, Math.min(base + 2 * variance, 2 * base));
    }

    public void clear() {
        positions.clear();
        confidences.clear();
        velocities.clear();
    }

    public int capacity() { return capacity; }
    public int size() { return positions.size(); }

    public List<Position> positions() { return List.copyOf(positions); }
    public List<Double> confidences() { return List.copyOf(confidences); }

    public List<double[]> velocities() {
        List<double[]> copy = new ArrayList<>();
        for (double[] v : velocities) copy.add(v.clone());
        return copy;
    }

    public Double lastConfidence() {
        return confidences.peekLast();
    }
}
