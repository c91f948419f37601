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

import io.colorizer.config.ColorizerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Publish/subscribe point for colorizer settings. Publishing replaces the
 * current configuration and notifies every subscriber in subscription order.
 */
public class SettingsChannel {

    private static final Logger logger = LoggerFactory.getLogger(SettingsChannel.class);

    private final List<SettingsListener> listeners = new CopyOnWriteArrayList<>();
    private volatile ColorizerConfig current;

    public SettingsChannel() {
        this(new ColorizerConfig());
    }

    public SettingsChannel(ColorizerConfig initial) {
        this.current = initial != null ? initial : new ColorizerConfig();
    }

    public ColorizerConfig getCurrent() {
        return current;
    }

    public void subscribe(SettingsListener listener) {
        listeners.add(listener);
    }

    public boolean unsubscribe(SettingsListener listener) {
        return listeners.remove(listener);
    }

    public int getSubscriberCount() {
        return listeners.size();
    }

    /**
     * A listener that throws does not stop the others from being notified.
     */
    public void publish(ColorizerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        current = config;
        logger.debug("settings changed, notifying {} subscriber(s)", listeners.size());
        for (SettingsListener listener : listeners) {
            try {
                listener.onSettingsChanged(config);
            } catch (RuntimeException e) {
                logger.warn("settings listener failed: {}", e.getMessage(), e);
            }
        }
    }

}
