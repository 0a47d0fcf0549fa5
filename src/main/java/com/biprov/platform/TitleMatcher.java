package com.biprov.platform;

/**
 * Decides whether an existing dashboard is the clone a run is looking for.
 *
 * Clone identity is currently the exact title string. Every title comparison goes through
 * here so a metadata-tag based match can replace it without touching the reconciler.
 */
public final class TitleMatcher {

    private TitleMatcher() {
        throw new UnsupportedOperationException("TitleMatcher is a utility class and cannot be instantiated");
    }

    public static boolean matches(String candidateTitle, String desiredTitle) {
        return candidateTitle != null && candidateTitle.equals(desiredTitle);
    }
}
