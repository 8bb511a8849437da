package com.astrophot.model;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    private static final String KEY_INNER_RADIUS = "inner_radius";
    private static final String KEY_INNER_ANNULUS = "inner_annulus";
    private static final String KEY_OUTER_ANNULUS = "outer_annulus";
    private static final String KEY_SEARCH_RADIUS = "search_radius";
    private static final String KEY_AUTO_TRACKING = "auto_tracking";
    private static final String KEY_HISTORY = "history_size";
    private static final String KEY_CONSENSUS = "consensus_tracking";
    private static final String KEY_LAST_FOLDER = "last_folder";
    private static final String KEY_STAR_NAME = "star_name";

    // --- APERTURA ---
    public static double getInnerRadius() { return prefs.getDouble(KEY_INNER_RADIUS, 9.0); }
    public static void setInnerRadius(double v) { prefs.putDouble(KEY_INNER_RADIUS, v); }

    public static double getInnerAnnulus() { return prefs.getDouble(KEY_INNER_ANNULUS, 12.0); }
    public static void setInnerAnnulus(double v) { prefs.putDouble(KEY_INNER_ANNULUS, v); }

    public static double getOuterAnnulus() { return prefs.getDouble(KEY_OUTER_ANNULUS, 17.0); }
    public static void setOuterAnnulus(double v) { prefs.putDouble(KEY_OUTER_ANNULUS, v); }

    // --- SEGUIMIENTO ---
    public static double getSearchRadius() { return prefs.getDouble(KEY_SEARCH_RADIUS, SessionSettings.DEFAULT_SEARCH_RADIUS); }
    public static void setSearchRadius(double v) { prefs.putDouble(KEY_SEARCH_RADIUS, v); }

    public static boolean isAutoTracking() { return prefs.getBoolean(KEY_AUTO_TRACKING, true); }
    public static void setAutoTracking(boolean v) { prefs.putBoolean(KEY_AUTO_TRACKING, v); }

    public static int getHistorySize() { return prefs.getInt(KEY_HISTORY, SessionSettings.DEFAULT_HISTORY_CAPACITY); }
    public static void setHistorySize(int v) { prefs.putInt(KEY_HISTORY, v); }

    public static boolean isConsensusTracking() { return prefs.getBoolean(KEY_CONSENSUS, false); }
    public static void setConsensusTracking(boolean v) { prefs.putBoolean(KEY_CONSENSUS, v); }

    // --- SESIÓN ---
    public static String getLastFolder() { return prefs.get(KEY_LAST_FOLDER, ""); }
    public static void setLastFolder(String v) { prefs.put(KEY_LAST_FOLDER, v); }

    public static String getStarName() { return prefs.get(KEY_STAR_NAME, ""); }
    public static void setStarName(String v) { prefs.put(KEY_STAR_NAME, v); }

    public static void setAperture(ApertureParams a) {
        setInnerRadius(a.innerRadius);
        setInnerAnnulus(a.innerAnnulus);
        setOuterAnnulus(a.outerAnnulus);
    }
}
