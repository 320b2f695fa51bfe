package com.synclab.laddersim.opcua;

import com.synclab.laddersim.engine.model.Operand;
import com.synclab.laddersim.simulation.SimulationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Interprets strings written to a session's {@code command} node:
 * {@code SCAN[:ms]}, {@code RESET}, {@code TOGGLE:tag}, {@code FORCE_ON:tag}, {@code FORCE_OFF:tag},
 * {@code UNFORCE:tag}, {@code SET:tag:value}, {@code AUTO_START}, {@code AUTO_STOP}.
 * Commands that change a tag or force are followed by a zero-time scan. Unknown or malformed
 * commands are logged and ignored.
 */
public class RungCommandHandler {

    private static final Logger log = LoggerFactory.getLogger(RungCommandHandler.class);

    private final long defaultScanMillis;

    public RungCommandHandler(long defaultScanMillis) {
        this.defaultScanMillis = defaultScanMillis;
    }

    /** @return {@code true} when the command was recognised and applied */
    public boolean handle(SimulationSession session, String command) {
        String text = command == null ? "" : command.trim();
        if (text.isEmpty()) {
            return false;
        }
        int colon = text.indexOf(':');
        String verb = (colon < 0 ? text : text.substring(0, colon)).trim().toUpperCase(Locale.ROOT);
        String argument = colon < 0 ? "" : text.substring(colon + 1).trim();
        try {
            switch (verb) {
                case "SCAN" -> session.scan(argument.isEmpty() ? defaultScanMillis : Long.parseLong(argument));
                case "RESET" -> session.reset();
                case "TOGGLE" -> {
                    session.toggleTag(requireTag(argument));
                    session.scan(0L);
                }
                case "FORCE_ON" -> {
                    session.forceOn(requireTag(argument));
                    session.scan(0L);
                }
                case "FORCE_OFF" -> {
                    session.forceOff(requireTag(argument));
                    session.scan(0L);
                }
                case "UNFORCE" -> {
                    session.removeForce(requireTag(argument));
                    session.scan(0L);
                }
                case "SET" -> {
                    set(session, argument);
                    session.scan(0L);
                }
                case "AUTO_START" -> session.startAutoScan();
                case "AUTO_STOP" -> session.stopAutoScan();
                default -> {
                    log.warn("[{}] Unknown command: {}", session.getId(), text);
                    return false;
                }
            }
        } catch (IllegalArgumentException e) {
            log.warn("[{}] Rejected command '{}': {}", session.getId(), text, e.getMessage());
            return false;
        }
        log.debug("[{}] command {} applied", session.getId(), text);
        return true;
    }

    private static void set(SimulationSession session, String argument) {
        int separator = argument.lastIndexOf(':');
        if (separator <= 0) {
            throw new IllegalArgumentException("SET needs tag:value");
        }
        String tag = requireTag(argument.substring(0, separator));
        String value = argument.substring(separator + 1).trim();
        if ("true".equalsIgnoreCase(value) || "on".equalsIgnoreCase(value)) {
            session.setTag(tag, true);
        } else if ("false".equalsIgnoreCase(value) || "off".equalsIgnoreCase(value)) {
            session.setTag(tag, false);
        } else if (Operand.isLiteral(value)) {
            session.setNumeric(tag, Operand.parseLiteral(value));
        } else {
            throw new IllegalArgumentException("not a boolean or number: " + value);
        }
    }

    private static String requireTag(String argument) {
        String tag = Operand.strip(argument);
        if (tag.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        return tag;
    }
}
