package org.gamboni.sideshelf.tech.bridge;

import java.util.function.Consumer;

/** Messaging channel provided by the native layer. Messages sent by any context are delivered to all contexts,
 * including the sender. */
public interface NativeTransport {
    void send(NativeMessage message);

    /** @return a function removing the listener */
    Runnable addListener(Consumer<NativeMessage> listener);
}
