package com.astrophot.model;

import java.util.List;
import java.util.Map;
import java.util.Objects;

public class PhotometryResult {
    public final int frameIndex;
    public final String fileName;
    public final String starName;
    public final Position position;
    public final double movement;       // distancia al cuadro anterior (px)
    public final boolean rgb;
    public final List<ChannelMeasurement> channels;
    public final ApertureParams aperture;
    public final Map<String, String> metadata; // cabecera FITS

    public PhotometryResult(int frameIndex, String fileName, String starName, Position position, double movement,
                            boolean rgb, List<ChannelMeasurement> channels, ApertureParams aperture,
                            Map<String, String> metadata) {
        this.frameIndex = frameIndex;
        this.fileName = fileName;
        this.starName = starName;
        this.position = position;
        this.movement = movement;
        this.rgb = rgb;
        this.channels = List.copyOf(channels);
        this.aperture = aperture;
        this.metadata = Map.copyOf(metadata);
    }

    public ChannelMeasurement channel(PixelPlane.Channel c) {
        for (ChannelMeasurement m : channels) if (m.channel == c) return m;
        throw new IllegalArgumentException("Canal no medido: " + c);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PhotometryResult)) return false;
        PhotometryResult r = (PhotometryResult) o;
        return frameIndex == r.frameIndex && Double.compare(movement, r.movement) == 0 && rgb == r.rgb
                && fileName.equals(r.fileName) && starName.equals(r.starName) && position.equals(r.position)
                && channels.equals(r.channels) && aperture.equals(r.aperture) && metadata.equals(r.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(frameIndex, fileName, starName, position, movement, rgb, channels, aperture, metadata);
    }
}
