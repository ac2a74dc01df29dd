package com.opentext.compression.model;

import java.util.Set;

/** File extensions of formats that are already compressed and gain nothing from another pass. */
public final class PrecompressedExtensions {

    public static final Set<String> DEFAULTS = Set.of(
            // images
            "png", "jpg", "jpeg", "gif", "webp", "avif",
            // fonts
            "woff", "woff2", "ttf", "eot",
            // media
            "mp4", "webm", "ogg", "mp3", "flac",
            // archives
            "zip", "gz", "br", "zst", "7z", "rar",
            "pdf", "ico");

    private PrecompressedExtensions() {
    }
}
