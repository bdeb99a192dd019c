/*
 * DnsJavaTXTResolver.java
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

import java.nio.charset.StandardCharsets;
import java.text.MessageFormat;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.ResourceBundle;
import java.util.concurrent.CompletionException;
import java.util.function.BiConsumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.xbill.DNS.DClass;
import org.xbill.DNS.ExtendedResolver;
import org.xbill.DNS.Message;
import org.xbill.DNS.Name;
import org.xbill.DNS.Rcode;
import org.xbill.DNS.Record;
import org.xbill.DNS.Resolver;
import org.xbill.DNS.Section;
import org.xbill.DNS.TXTRecord;
import org.xbill.DNS.TextParseException;
import org.xbill.DNS.Type;

/**
 * TXT lookups through dnsjava.
 *
 * <p>Queries are sent asynchronously with {@link Resolver#sendAsync}; the
 * callback is invoked on a dnsjava thread. By default the system's
 * configured name servers are used.
 *
 * @author <a href='mailto:dog@gnu.org'>Chris Burdess</a>
 */
public class DnsJavaTXTResolver implements TXTResolver {

    private static final Logger LOGGER = Logger.getLogger(DnsJavaTXTResolver.class.getName());
    private static final ResourceBundle L10N =
            ResourceBundle.getBundle("org.bluezoo.dkim.dns.L10N");

    private final Resolver resolver;

    /**
     * Creates a resolver using the system name servers.
     */
    public DnsJavaTXTResolver() {
        this(new ExtendedResolver());
    }

    /**
     * Creates a resolver using a specific dnsjava resolver.
     *
     * @param resolver the dnsjava resolver
     */
    public DnsJavaTXTResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    /**
     * Sets the timeout of the underlying resolver. The key resolver applies
     * its own timeout on top of this.
     *
     * @param timeout the timeout in milliseconds
     */
    public void setTimeout(long timeout) {
        resolver.setTimeout(Duration.ofMillis(timeout));
    }

    @Override
    public void lookupTXT(final String name, final TXTCallback callback) {
        Message query;
        try {
            Name qname = Name.fromString(name, Name.root);
            query = Message.newQuery(Record.newRecord(qname, Type.TXT, DClass.IN));
        } catch (TextParseException e) {
            callback.onError(MessageFormat.format(L10N.getString("err.bad_name"), name, e.getMessage()));
            return;
        }
        resolver.sendAsync(query).whenComplete(new BiConsumer<Message, Throwable>() {
            @Override
            public void accept(Message response, Throwable error) {
                if (error != null) {
                    Throwable cause = (error instanceof CompletionException && error.getCause() != null)
                            ? error.getCause() : error;
                    if (LOGGER.isLoggable(Level.FINE)) {
                        LOGGER.log(Level.FINE, MessageFormat.format(L10N.getString("debug.query_failed"), name), cause);
                    }
                    callback.onError(String.valueOf(cause.getMessage()));
                } else {
                    handleResponse(name, response, callback);
                }
            }
        });
    }

    /**
     * Interprets a DNS response.
     */
    static void handleResponse(String name, Message response, TXTCallback callback) {
        int rcode = response.getRcode();
        if (rcode == Rcode.NXDOMAIN) {
            callback.onNotFound();
            return;
        }
        if (rcode != Rcode.NOERROR) {
            callback.onError(MessageFormat.format(L10N.getString("err.rcode"), name, Rcode.string(rcode)));
            return;
        }
        List<List<String>> records = new ArrayList<List<String>>();
        List<Record> answers = response.getSection(Section.ANSWER);
        for (int i = 0; i < answers.size(); i++) {
            Record record = answers.get(i);
            if (record instanceof TXTRecord) {
                List<byte[]> strings = ((TXTRecord) record).getStringsAsByteArrays();
                List<String> texts = new ArrayList<String>(strings.size());
                for (int j = 0; j < strings.size(); j++) {
                    texts.add(new String(strings.get(j), StandardCharsets.ISO_8859_1));
                }
                records.add(texts);
            }
        }
        if (records.isEmpty()) {
            callback.onNotFound();
        } else {
            callback.onRecords(records);
        }
    }

}
