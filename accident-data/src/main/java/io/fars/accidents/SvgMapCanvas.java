package io.fars.accidents;

import io.fars.core.CoordinateRange;
import io.fars.core.GeoPoint;
import io.fars.core.MapRenderer;
import io.fars.core.PointPlotter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Renders a state map as SVG: an equirectangular frame over the requested bounds with a degree
 * graticule, and one dot per located point inside the frame. Bounds are limited to the globe.
 * One canvas holds one map.
 */
public class SvgMapCanvas implements MapRenderer, PointPlotter {
    private static final int MARGIN = 40;
    private static final double MIN_SPAN = 1.0;
    private static final double POINT_RADIUS = 1.5;

    private final int width;
    private final int height;
    private final StringBuilder body = new StringBuilder();
    private CoordinateRange lon;
    private CoordinateRange lat;
    private int pointsDrawn;

    public SvgMapCanvas(int width, int height) {
        if (width <= 2 * MARGIN || height <= 2 * MARGIN) {
            throw new IllegalArgumentException("canvas too small: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
    }

    @Override
    public void drawBaseMap(String region, CoordinateRange longitude, CoordinateRange latitude) {
        this.lon = widen(longitude.clamp(-180, 180));
        this.lat = widen(latitude.clamp(-90, 90));
        body.setLength(0);
        pointsDrawn = 0;

        body.append(fmt("<rect x=\"%d\" y=\"%d\" width=\"%d\" height=\"%d\" fill=\"#f4f1ea\" stroke=\"#555\"/>%n",
                MARGIN, MARGIN, width - 2 * MARGIN, height - 2 * MARGIN));
        double step = gridStep(Math.max(lon.span(), lat.span()));
        for (long k = (long) Math.ceil(lon.min() / step); k * step <= lon.max(); k++) {
            double x = k * step;
            double px = projectX(x);
            body.append(fmt("<line x1=\"%.2f\" y1=\"%d\" x2=\"%.2f\" y2=\"%d\" stroke=\"#ccc\" stroke-width=\"0.5\"/>%n",
                    px, MARGIN, px, height - MARGIN));
            body.append(fmt("<text x=\"%.2f\" y=\"%d\" font-size=\"10\" text-anchor=\"middle\">%s</text>%n",
                    px, height - MARGIN + 14, label(x)));
        }
        for (long k = (long) Math.ceil(lat.min() / step); k * step <= lat.max(); k++) {
            double y = k * step;
            double py = projectY(y);
            body.append(fmt("<line x1=\"%d\" y1=\"%.2f\" x2=\"%d\" y2=\"%.2f\" stroke=\"#ccc\" stroke-width=\"0.5\"/>%n",
                    MARGIN, py, width - MARGIN, py));
            body.append(fmt("<text x=\"%d\" y=\"%.2f\" font-size=\"10\" text-anchor=\"end\">%s</text>%n",
                    MARGIN - 4, py + 3, label(y)));
        }
        body.append(fmt("<text x=\"%d\" y=\"%d\" font-size=\"14\">%s</text>%n", MARGIN, MARGIN - 12, escape(region)));
    }

    @Override
    public void plotPoints(List<GeoPoint> points) {
        if (lon == null) throw new IllegalStateException("base map not drawn");
        for (GeoPoint p : points) {
            if (!p.isLocated() || !lon.contains(p.longitude()) || !lat.contains(p.latitude())) continue;
            body.append(fmt("<circle cx=\"%.2f\" cy=\"%.2f\" r=\"%.1f\" fill=\"#b2182b\"/>%n",
                    projectX(p.longitude()), projectY(p.latitude()), POINT_RADIUS));
            pointsDrawn++;
        }
    }

    public int pointsDrawn() { return pointsDrawn; }

    public String toSvg() {
        return fmt("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%d\" height=\"%d\" viewBox=\"0 0 %d %d\">%n",
                width, height, width, height) + body + "</svg>\n";
    }

    public void writeTo(Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        Files.writeString(file, toSvg(), StandardCharsets.UTF_8);
    }

    double projectX(double longitude) {
        return MARGIN + (longitude - lon.min()) / lon.span() * (width - 2 * MARGIN);
    }

    double projectY(double latitude) {
        return MARGIN + (lat.max() - latitude) / lat.span() * (height - 2 * MARGIN);
    }

    // a single accident yields a zero-width range
    private static CoordinateRange widen(CoordinateRange r) {
        if (r.span() >= MIN_SPAN) return r;
        double pad = (MIN_SPAN - r.span()) / 2;
        return new CoordinateRange(r.min() - pad, r.max() + pad);
    }

    private static double gridStep(double span) {
        if (span > 60) return 10;
        if (span > 20) return 5;
        return 1;
    }

    private static String label(double degrees) {
        return fmt("%.0f", degrees);
    }

    private static String escape(String s) {
        return s.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
