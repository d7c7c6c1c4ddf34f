package org.smileyface.newscrawler.crawler;

import java.util.HashSet;
import java.util.Set;

/**
 * URLs handled during one (source, date) walk. Not shared between walks and never persisted.
 */
public class SessionCache {

    private final Set<String> seen = new HashSet<>();

    public boolean contains(String url) {
        return seen.contains(url);
    }

    public void add(String url) {
        seen.add(url);
    }

    public int size() {
        return seen.size();
    }
}
