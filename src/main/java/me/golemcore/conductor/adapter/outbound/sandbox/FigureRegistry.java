package me.golemcore.conductor.adapter.outbound.sandbox;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Visual artifacts produced during one run, rendered as SVG. Harvested into the
 * output directory once the run succeeds.
 */
class FigureRegistry {

    private static final int WIDTH = 640;
    private static final int HEIGHT = 400;
    private static final int MARGIN = 40;

    record Figure(String fileName, String svg) {
    }

    private final List<Figure> figures = new ArrayList<>();

    synchronized String register(String name, String svg) {
        String fileName = name != null && !name.isBlank() ? sanitize(name) : "plot_" + (figures.size() + 1);
        if (!fileName.endsWith(".svg")) {
            fileName = fileName + ".svg";
        }
        figures.add(new Figure(fileName, svg));
        return fileName;
    }

    synchronized List<Figure> figures() {
        return List.copyOf(figures);
    }

    static String lineChart(List<Double> values, String title) {
        StringBuilder points = new StringBuilder();
        double[] range = range(values);
        double stepX = values.size() > 1 ? (double) (WIDTH - 2 * MARGIN) / (values.size() - 1) : 0;
        for (int i = 0; i < values.size(); i++) {
            double x = MARGIN + i * stepX;
            double y = scaleY(values.get(i), range);
            points.append(format(x)).append(',').append(format(y)).append(' ');
        }
        return open(title)
                + "<polyline fill=\"none\" stroke=\"#1f77b4\" stroke-width=\"2\" points=\""
                + points.toString().trim() + "\"/>"
                + close();
    }

    static String barChart(List<String> labels, List<Double> values, String title) {
        StringBuilder bars = new StringBuilder();
        double[] range = range(values);
        range[0] = Math.min(0, range[0]);
        double slot = values.isEmpty() ? 0 : (double) (WIDTH - 2 * MARGIN) / values.size();
        double baseline = scaleY(0, range);
        for (int i = 0; i < values.size(); i++) {
            double top = scaleY(values.get(i), range);
            double x = MARGIN + i * slot + slot * 0.1;
            bars.append("<rect x=\"").append(format(x))
                    .append("\" y=\"").append(format(Math.min(top, baseline)))
                    .append("\" width=\"").append(format(slot * 0.8))
                    .append("\" height=\"").append(format(Math.abs(baseline - top)))
                    .append("\" fill=\"#1f77b4\"/>");
            if (i < labels.size()) {
                bars.append("<text x=\"").append(format(x + slot * 0.4))
                        .append("\" y=\"").append(HEIGHT - MARGIN / 4)
                        .append("\" font-size=\"11\" text-anchor=\"middle\">")
                        .append(escape(labels.get(i))).append("</text>");
            }
        }
        return open(title) + bars + close();
    }

    private static String open(String title) {
        StringBuilder svg = new StringBuilder()
                .append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"").append(WIDTH)
                .append("\" height=\"").append(HEIGHT).append("\" viewBox=\"0 0 ").append(WIDTH).append(' ')
                .append(HEIGHT).append("\">")
                .append("<rect width=\"100%\" height=\"100%\" fill=\"white\"/>");
        if (title != null && !title.isBlank()) {
            svg.append("<text x=\"").append(WIDTH / 2).append("\" y=\"").append(MARGIN / 2)
                    .append("\" font-size=\"14\" text-anchor=\"middle\">").append(escape(title)).append("</text>");
        }
        return svg.toString();
    }

    private static String close() {
        return "</svg>";
    }

    private static double[] range(List<Double> values) {
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        if (values.isEmpty()) {
            return new double[] { 0, 1 };
        }
        if (max == min) {
            max = min + 1;
        }
        return new double[] { min, max };
    }

    private static double scaleY(double value, double[] range) {
        double usable = HEIGHT - 2.0 * MARGIN;
        return HEIGHT - MARGIN - (value - range[0]) / (range[1] - range[0]) * usable;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("\"", "&quot;");
    }

    private static String sanitize(String name) {
        String base = name.replace('\\', '/');
        int slash = base.lastIndexOf('/');
        if (slash >= 0) {
            base = base.substring(slash + 1);
        }
        base = base.replaceAll("[^A-Za-z0-9._-]", "_");
        return base.isBlank() || base.startsWith(".") ? "plot" + base : base;
    }
}
