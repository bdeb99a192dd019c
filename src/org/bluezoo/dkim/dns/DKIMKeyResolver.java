/*
 * DKIMKeyResolver.java
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

import java.text.MessageFormat;
import java.text.ParseException;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.bluezoo.dkim.DKIMFailure;
import org.bluezoo.dkim.DKIMKeyException;
import org.bluezoo.dkim.DKIMPublicKey;
import org.bluezoo.dkim.TagList;

/**
 * Retrieves DKIM key records from DNS (RFC 6376 section 3.6.2).
 *
 * <p>Keys are published as TXT records at
 * {@code <selector>._domainkey.<domain>}. Every lookup is bounded by a
 * timeout; when it expires the callback is told
 * {@link DKIMFailure#KEY_DNS_FAILURE} and any later answer is dropped.
 *
 * <p>Outcomes are mapped as follows:
 * <ul>
 * <li>no such name, or no TXT record: {@link DKIMFailure#KEY_NOT_FOUND}</li>
 * <li>timeout or DNS error: {@link DKIMFailure#KEY_DNS_FAILURE}</li>
 * <li>unparseable record: {@link DKIMFailure#KEY_MALFORMED}</li>
 * <li>empty {@code p=}: {@link DKIMFailure#KEY_REVOKED}</li>
 * </ul>
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DKIMKeyResolver {

    private static final Logger LOGGER = Logger.getLogger(DKIMKeyResolver.class.getName());
    private static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.dkim.dns.L10N");

    /** The record selection policy used unless another is set. */
    public static final KeyRecordSelection DEFAULT_SELECTION = KeyRecordSelection.FIRST;

    /** Default lookup timeout in milliseconds. */
    public static final long DEFAULT_TIMEOUT_MS = 5000L;

    private final TXTResolver resolver;
    private KeyRecordSelection selection = DEFAULT_SELECTION;
    private long timeout = DEFAULT_TIMEOUT_MS;
    private ScheduledExecutorService scheduler;

    /**
     * Creates a key resolver.
     *
     * @param resolver the DNS capability to query
     */
    public DKIMKeyResolver(TXTResolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Sets how to choose among several records at one name.
     *
     * @param selection the selection policy
     */
    public void setSelection(KeyRecordSelection selection) {
        this.selection = selection;
    }

    public KeyRecordSelection getSelection() {
        return selection;
    }

    /**
     * Sets the lookup timeout.
     *
     * @param timeout the timeout in milliseconds
     */
    public void setTimeout(long timeout) {
        this.timeout = timeout;
    }

    public long getTimeout() {
        return timeout;
    }

    /**
     * Sets the executor used to schedule lookup timeouts. By default a
     * shared daemon thread is used.
     *
     * @param scheduler the scheduler
     */
    public void setScheduler(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Returns the DNS name at which a key is published.
     *
     * @param selector the selector ({@code s=})
     * @param domain the signing domain ({@code d=})
     * @return the query name
     */
    public static String queryName(String selector, String domain) {
        return selector + "._domainkey." + domain;
    }

    /**
     * Retrieves a key record asynchronously.
     *
     * @param selector the selector
     * @param domain the signing domain
     * @param callback the callback, invoked exactly once
     */
    public void resolve(String selector, String domain, KeyCallback callback) {
        final String name = queryName(selector, domain);
        final KeyCallback target = callback;
        final AtomicBoolean done = new AtomicBoolean();
        ScheduledExecutorService timer = (scheduler != null) ? scheduler : SharedScheduler.INSTANCE;
        final ScheduledFuture<?> timeoutTask = timer.schedule(new Runnable() {
            @Override
            public void run() {
                if (done.compareAndSet(false, true)) {
                    String message = MessageFormat.format(L10N.getString("err.key_timeout"),
                            name, Long.valueOf(timeout));
                    target.keyFailed(new DKIMKeyException(DKIMFailure.KEY_DNS_FAILURE, message));
                }
            }
        }, timeout, TimeUnit.MILLISECONDS);

        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.key_lookup"), name));
        }
        TXTCallback txtCallback = new TXTCallback() {

            @Override
            public void onRecords(List<List<String>> records) {
                if (claim()) {
                    deliver(name, records, target);
                }
            }

            @Override
            public void onNotFound() {
                if (claim()) {
                    String message = MessageFormat.format(L10N.getString("err.key_not_found"), name);
                    target.keyFailed(new DKIMKeyException(DKIMFailure.KEY_NOT_FOUND, message));
                }
            }

            @Override
            public void onError(String error) {
                if (claim()) {
                    String message = MessageFormat.format(L10N.getString("err.key_dns"), name, error);
                    target.keyFailed(new DKIMKeyException(DKIMFailure.KEY_DNS_FAILURE, message));
                }
            }

            private boolean claim() {
                if (done.compareAndSet(false, true)) {
                    timeoutTask.cancel(false);
                    return true;
                }
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.fine(MessageFormat.format(L10N.getString("debug.late_answer"), name));
                }
                return false;
            }

        };
        try {
            resolver.lookupTXT(name, txtCallback);
        } catch (RuntimeException e) {
            // A resolver that throws fails this lookup only
            LOGGER.log(Level.FINE, MessageFormat.format(L10N.getString("debug.lookup_threw"), name), e);
            if (done.compareAndSet(false, true)) {
                timeoutTask.cancel(false);
                String message = MessageFormat.format(L10N.getString("err.key_dns"), name, e.toString());
                target.keyFailed(new DKIMKeyException(DKIMFailure.KEY_DNS_FAILURE, message, e));
            }
        }
    }

    private void deliver(String name, List<List<String>> records, KeyCallback callback) {
        String text = select(records);
        if (text == null) {
            String message = MessageFormat.format(L10N.getString("err.key_not_found"), name);
            callback.keyFailed(new DKIMKeyException(DKIMFailure.KEY_NOT_FOUND, message));
            return;
        }
        DKIMPublicKey key;
        try {
            key = DKIMPublicKey.parse(text);
        } catch (DKIMKeyException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(MessageFormat.format(L10N.getString("debug.key_malformed"),
                        name, e.getMessage()));
            }
            callback.keyFailed(e);
            return;
        }
        if (key.isRevoked()) {
            String message = MessageFormat.format(L10N.getString("err.key_revoked"), name);
            callback.keyFailed(new DKIMKeyException(DKIMFailure.KEY_REVOKED, message));
            return;
        }
        callback.keyResolved(key);
    }

    /**
     * Chooses one record and joins its strings.
     */
    String select(List<List<String>> records) {
        if (records.isEmpty()) {
            return null;
        }
        if (records.size() > 1 && LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(MessageFormat.format(L10N.getString("debug.multiple_records"),
                    Integer.valueOf(records.size()), selection));
        }
        if (selection == KeyRecordSelection.FIRST_WITH_KEY) {
            for (int i = 0; i < records.size(); i++) {
                String text = join(records.get(i));
                if (hasKeyTag(text)) {
                    return text;
                }
            }
        }
        return join(records.get(0));
    }

    private static boolean hasKeyTag(String text) {
        try {
            return TagList.parse(text).contains("p");
        } catch (ParseException e) {
            return false;
        }
    }

    /**
     * The strings of one TXT record are concatenated without separator.
     */
    static String join(List<String> strings) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < strings.size(); i++) {
            sb.append(strings.get(i));
        }
        return sb.toString();
    }

    /**
     * Lazily created timer for lookup timeouts.
     */
    private static class SharedScheduler {

        static final ScheduledThreadPoolExecutor INSTANCE;

        static {
            INSTANCE = new ScheduledThreadPoolExecutor(1, new ThreadFactory() {
                @Override
                public Thread newThread(Runnable r) {
                    Thread thread = new Thread(r, "dkim-key-timeout");
                    thread.setDaemon(true);
                    return thread;
                }
            });
            INSTANCE.setRemoveOnCancelPolicy(true);
        }

    }

}
