/*
 * CachingTXTResolver.java
 * Copyright (C) 2025 Chris Burdess
 *
 * This file is part of bluezoo-dkim, a DKIM library for Java.
 * For more information please visit https://www.nongnu.org/gumdrop/
 *
 * bluezoo-dkim is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * bluezoo-dkim is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Lesser General Public License for more details.
 *
 * You should have received a copy of the GNU Lesser General Public License
 * along with bluezoo-dkim.  If not, see <http://www.gnu.org/licenses/>.
 */

package org.bluezoo.dkim.dns;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A TXT resolver that caches the answers of another.
 *
 * <p>Both positive answers and negative answers (name not found) are
 * cached, each with its own TTL. Errors are never cached. When the cache
 * is full, expired entries are removed first, then the entries closest to
 * expiry.
 *
 * <p>This class is thread-safe.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class CachingTXTResolver implements TXTResolver {

    private static final Logger LOGGER = Logger.getLogger(CachingTXTResolver.class.getName());

    private static final int DEFAULT_MAX_ENTRIES = 10000;
    private static final long DEFAULT_POSITIVE_TTL = 3600; // 1 hour
    private static final long DEFAULT_NEGATIVE_TTL = 300; // 5 minutes

    private final TXTResolver resolver;
    private final Map<String, CacheEntry> cache;
    private int maxEntries = DEFAULT_MAX_ENTRIES;
    private long positiveTTL = DEFAULT_POSITIVE_TTL;
    private long negativeTTL = DEFAULT_NEGATIVE_TTL;
    private Clock clock = Clock.systemUTC();

    /**
     * Creates a caching resolver.
     *
     * @param resolver the resolver to query on a cache miss
     */
    public CachingTXTResolver(TXTResolver resolver) {
        this.resolver = resolver;
        this.cache = new ConcurrentHashMap<String, CacheEntry>();
    }

    /**
     * Sets the maximum number of cached names.
     *
     * @param maxEntries the maximum number of entries
     */
    public void setMaxEntries(int maxEntries) {
        this.maxEntries = maxEntries;
    }

    /**
     * Sets how long records are cached.
     *
     * @param seconds the TTL in seconds
     */
    public void setPositiveTTL(long seconds) {
        this.positiveTTL = seconds;
    }

    /**
     * Sets how long non-existence is cached.
     *
     * @param seconds the TTL in seconds
     */
    public void setNegativeTTL(long seconds) {
        this.negativeTTL = seconds;
    }

    public void setClock(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void lookupTXT(final String name, final TXTCallback callback) {
        final String key = name.toLowerCase(Locale.ROOT);
        CacheEntry entry = cache.get(key);
        if (entry != null) {
            if (entry.expiryTime <= clock.millis()) {
                cache.remove(key, entry);
            } else {
                if (LOGGER.isLoggable(Level.FINEST)) {
                    LOGGER.finest("Cache hit: " + name);
                }
                if (entry.records == null) {
                    callback.onNotFound();
                } else {
                    callback.onRecords(entry.records);
                }
                return;
            }
        }
        resolver.lookupTXT(name, new TXTCallback() {

            @Override
            public void onRecords(List<List<String>> records) {
                List<List<String>> copy = new ArrayList<List<String>>(records.size());
                for (int i = 0; i < records.size(); i++) {
                    copy.add(Collections.unmodifiableList(new ArrayList<String>(records.get(i))));
                }
                copy = Collections.unmodifiableList(copy);
                put(key, new CacheEntry(copy, positiveTTL));
                callback.onRecords(copy);
            }

            @Override
            public void onNotFound() {
                put(key, new CacheEntry(null, negativeTTL));
                callback.onNotFound();
            }

            @Override
            public void onError(String error) {
                callback.onError(error);
            }

        });
    }

    /**
     * Clears all cached entries.
     */
    public void clear() {
        cache.clear();
    }

    /**
     * Returns the number of cached entries.
     *
     * @return the cache size
     */
    public int size() {
        return cache.size();
    }

    /**
     * Removes expired entries from the cache.
     *
     * @return the number of entries removed
     */
    public int evictExpired() {
        long now = clock.millis();
        int removed = 0;
        Iterator<Map.Entry<String, CacheEntry>> it = cache.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, CacheEntry> entry = it.next();
            if (entry.getValue().expiryTime <= now) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private void put(String key, CacheEntry entry) {
        if (entry.ttl <= 0) {
            return;
        }
        evictIfNeeded();
        cache.put(key, entry);
    }

    private void evictIfNeeded() {
        if (cache.size() >= maxEntries) {
            evictExpired();
            // Still full: remove the tenth of entries closest to expiry
            if (cache.size() >= maxEntries) {
                int toRemove = Math.max(1, maxEntries / 10);
                List<Map.Entry<String, CacheEntry>> entries =
                        new ArrayList<Map.Entry<String, CacheEntry>>(cache.entrySet());
                Collections.sort(entries, new Comparator<Map.Entry<String, CacheEntry>>() {
                    @Override
                    public int compare(Map.Entry<String, CacheEntry> a, Map.Entry<String, CacheEntry> b) {
                        return Long.compare(a.getValue().expiryTime, b.getValue().expiryTime);
                    }
                });
                for (int i = 0; i < toRemove && i < entries.size(); i++) {
                    cache.remove(entries.get(i).getKey());
                }
            }
        }
    }

    /**
     * A cached answer; null records means the name was not found.
     */
    private class CacheEntry {

        final List<List<String>> records;
        final long ttl;
        final long expiryTime;

        CacheEntry(List<List<String>> records, long ttl) {
            this.records = records;
            this.ttl = ttl;
            this.expiryTime = clock.millis() + ttl * 1000L;
        }

    }

}
