package com.astrophot.service;

import nom.tam.fits.Header;
import nom.tam.fits.HeaderCard;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FitsHeaderService {

    // Claves de tiempo primero, luego las de instrumento
    static final List<String> KEYWORDS = List.of(
            "DATE-OBS", "TIME-OBS", "JD", "MJD", "DATEOBS",
            "EXPTIME", "EXPOSURE", "FILTER", "OBJECT", "OBSERVER",
            "TELESCOP", "INSTRUME", "XPIXSZ", "YPIXSZ");

    public Map<String, String> readMetadata(Header header, File f) {
        Map<String, String> meta = new LinkedHashMap<>();
        for (String key : KEYWORDS) {
            HeaderCard card = header.findCard(key);
            if (card != null && card.getValue() != null) {
                meta.put("fits_" + key.toLowerCase(Locale.ROOT), card.getValue().trim());
            }
        }
        if (f != null) meta.put("file_mtime", String.valueOf(f.lastModified() / 1000.0));
        return meta;
    }
}
