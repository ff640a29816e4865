package com.phillippitts.voicedaemon.service.state;

import com.phillippitts.voicedaemon.domain.DaemonResponse;

/**
 * Receives the event produced by every accepted transition, on the control thread.
 * Implementations must not block.
 */
@FunctionalInterface
public interface StateEventListener {

    void onStateEvent(DaemonResponse event);
}
