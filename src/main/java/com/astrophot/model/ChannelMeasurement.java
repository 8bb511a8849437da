package com.astrophot.model;

import java.util.Objects;

public final class ChannelMeasurement {
    public final PixelPlane.Channel channel;
    public final double rawFlux;
    public final double skyMedian;          // por pixel
    public final double skyStd;
    public final double skyBackgroundTotal; // skyMedian * área del disco
    public final double correctedFlux;
    public final double poissonNoise;
    public final double apertureArea;
    public final int annulusPixelCount;

    public ChannelMeasurement(PixelPlane.Channel channel, double rawFlux, double skyMedian, double skyStd,
                              double skyBackgroundTotal, double correctedFlux, double poissonNoise,
                              double apertureArea, int annulusPixelCount) {
        this.channel = channel;
        this.rawFlux = rawFlux;
        this.skyMedian = skyMedian;
        this.skyStd = skyStd;
        this.skyBackgroundTotal = skyBackgroundTotal;
        this.correctedFlux = correctedFlux;
        this.poissonNoise = poissonNoise;
        this.apertureArea = apertureArea;
        this.annulusPixelCount = annulusPixelCount;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelMeasurement)) return false;
        ChannelMeasurement m = (ChannelMeasurement) o;
        return channel == m.channel
                && Double.compare(rawFlux, m.rawFlux) == 0
                && Double.compare(skyMedian, m.skyMedian) == 0
                && Double.compare(skyStd, m.skyStd) == 0
                && Double.compare(skyBackgroundTotal, m.skyBackgroundTotal) == 0
                && Double.compare(correctedFlux, m.correctedFlux) == 0
                && Double.compare(poissonNoise, m.poissonNoise) == 0
                && Double.compare(apertureArea, m.apertureArea) == 0
                && annulusPixelCount == m.annulusPixelCount;
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, rawFlux, skyMedian, skyStd, skyBackgroundTotal, correctedFlux, poissonNoise,
                apertureArea, annulusPixelCount);
    }

    @Override
    public String toString() {
        return channel + ": bruto=" + rawFlux + " cielo=" + skyMedian + " corregido=" + correctedFlux;
    }
}
