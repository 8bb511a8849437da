package com.astrophot.model;

import java.util.Objects;

/**
 * Geometría de la apertura: disco de señal y anillo de fondo (pixeles).
 * Si innerAnnulus >= outerAnnulus no se resta cielo.
 */
public final class ApertureParams {
    public final double innerRadius;
    public final double innerAnnulus;
    public final double outerAnnulus;

    public ApertureParams(double innerRadius, double innerAnnulus, double outerAnnulus) {
        if (!(innerRadius > 0)) {
            throw new InvalidApertureException("innerRadius debe ser > 0 (recibido " + innerRadius + ")");
        }
        this.innerRadius = innerRadius;
        this.innerAnnulus = innerAnnulus;
        this.outerAnnulus = outerAnnulus;
    }

    public boolean isSkySubtractionEnabled() {
        return innerAnnulus < outerAnnulus;
    }

    // Área analítica del disco, no el conteo de pixeles
    public double apertureArea() {
        return Math.PI * innerRadius * innerRadius;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ApertureParams)) return false;
        ApertureParams a = (ApertureParams) o;
        return Double.compare(innerRadius, a.innerRadius) == 0
                && Double.compare(innerAnnulus, a.innerAnnulus) == 0
                && Double.compare(outerAnnulus, a.outerAnnulus) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(innerRadius, innerAnnulus, outerAnnulus);
    }

    @Override
    public String toString() {
        return "r=" + innerRadius + " anillo=" + innerAnnulus + ".." + outerAnnulus;
    }
}
