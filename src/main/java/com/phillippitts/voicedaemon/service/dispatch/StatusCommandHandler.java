package com.phillippitts.voicedaemon.service.dispatch;

import com.phillippitts.voicedaemon.domain.Command;
import com.phillippitts.voicedaemon.domain.CommandKind;
import com.phillippitts.voicedaemon.service.metrics.DaemonMetrics;
import com.phillippitts.voicedaemon.service.session.SessionRegistry;
import com.phillippitts.voicedaemon.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * GET_STATUS and PING. Neither causes a transition, so both are answered in every phase.
 */
@Component
class StatusCommandHandler implements CommandHandler {

    private final SessionRegistry registry;
    private final DaemonMetrics metrics;
    private final long startedNanos = System.nanoTime();

    StatusCommandHandler(SessionRegistry registry, DaemonMetrics metrics) {
        this.registry = registry;
        this.metrics = metrics;
    }

    @Override
    public Set<CommandKind> kinds() {
        return EnumSet.of(CommandKind.GET_STATUS, CommandKind.PING);
    }

    @Override
    public Map<String, Object> handle(Command command) {
        if (command.kind() == CommandKind.PING) {
            return Map.of("message", "PONG");
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("sessions", registry.size());
        data.put("telemetry", metrics.summary());
        data.put("uptime_ms", TimeUtils.elapsedMillis(startedNanos));
        return data;
    }
}
