/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.colorizer.host;

import io.colorizer.brackets.BracketScanner;
import io.colorizer.brackets.ScanOptions;
import io.colorizer.brackets.ScanResult;
import io.colorizer.common.Resource;
import io.colorizer.config.ColorizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps the range set currently applied to each open document. A re-scan
 * replaces a document's ranges in one step, closing a document releases them,
 * and a settings change re-highlights every open document.
 */
public class HighlightRegistry implements SettingsListener {

    private static final Logger logger = LoggerFactory.getLogger(HighlightRegistry.class);

    private record Document(Resource resource, String languageId, ScanResult result) {

    }

    private final SettingsChannel settings;
    private final boolean useLexer;
    private final Map<String, Document> documents = new ConcurrentHashMap<>();
    private final List<HighlightListener> listeners = new CopyOnWriteArrayList<>();

    public HighlightRegistry(SettingsChannel settings) {
        this(settings, true);
    }

    /**
     * @param useLexer false to always scan raw text
     */
    public HighlightRegistry(SettingsChannel settings, boolean useLexer) {
        this.settings = settings;
        this.useLexer = useLexer;
        settings.subscribe(this);
    }

    public void addListener(HighlightListener listener) {
        listeners.add(listener);
    }

    /**
     * Scans a document and applies its ranges, replacing any earlier set.
     *
     * @param languageId overrides the language guessed from the resource path, may be null
     */
    public ScanResult open(String documentId, Resource resource, String languageId) {
        return apply(documentId, resource, languageId, settings.getCurrent().toScanOptions());
    }

    public ScanResult open(String documentId, Resource resource) {
        return open(documentId, resource, null);
    }

    /**
     * Re-scans an open document after its text changed.
     *
     * @throws IllegalStateException if the document is not open
     */
    public ScanResult update(String documentId, String text) {
        Document document = documents.computeIfPresent(documentId, (id, current) -> {
            Resource resource = Resource.text(text, current.resource().getRelativePath());
            return scan(resource, current.languageId(), settings.getCurrent().toScanOptions());
        });
        if (document == null) {
            throw new IllegalStateException("document not open: " + documentId);
        }
        return applied(documentId, document);
    }

    /**
     * Releases the ranges of a document.
     *
     * @return true if the document was open
     */
    public boolean close(String documentId) {
        Document removed = documents.remove(documentId);
        if (removed == null) {
            return false;
        }
        logger.debug("released {} range(s) of {}", removed.result().ranges().size(), documentId);
        notifyListeners(documentId, null);
        return true;
    }

    public ScanResult get(String documentId) {
        Document document = documents.get(documentId);
        return document == null ? null : document.result();
    }

    public boolean isOpen(String documentId) {
        return documents.containsKey(documentId);
    }

    public Set<String> getDocumentIds() {
        return new TreeSet<>(documents.keySet());
    }

    public int size() {
        return documents.size();
    }

    public void dispose() {
        settings.unsubscribe(this);
        for (String id : new ArrayList<>(documents.keySet())) {
            close(id);
        }
    }

    @Override
    public void onSettingsChanged(ColorizerConfig config) {
        ScanOptions options = config.toScanOptions();
        logger.debug("re-highlighting {} open document(s)", documents.size());
        for (String id : new ArrayList<>(documents.keySet())) {
            // rescans the latest text, skips documents closed since the snapshot
            Document document = documents.computeIfPresent(id,
                    (key, current) -> scan(current.resource(), current.languageId(), options));
            if (document != null) {
                applied(id, document);
            }
        }
    }

    private ScanResult apply(String documentId, Resource resource, String languageId, ScanOptions options) {
        Document document = scan(resource, languageId, options);
        documents.put(documentId, document);
        return applied(documentId, document);
    }

    private Document scan(Resource resource, String languageId, ScanOptions options) {
        return new Document(resource, languageId, BracketScanner.scan(resource, languageId, options, useLexer));
    }

    private ScanResult applied(String documentId, Document document) {
        ScanResult result = document.result();
        if (logger.isTraceEnabled()) {
            logger.trace("{}: {} range(s), {} inactive", documentId, result.ranges().size(), result.inactive().size());
        }
        notifyListeners(documentId, result);
        return result;
    }

    private void notifyListeners(String documentId, ScanResult result) {
        for (HighlightListener listener : listeners) {
            listener.onHighlight(documentId, result);
        }
    }

}
