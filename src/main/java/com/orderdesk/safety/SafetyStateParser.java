package com.orderdesk.safety;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a raw kill switch or circuit breaker payload into a {@link SafetyState}.
 *
 * <p>Never throws. Every defect maps to an unverified {@link SafetyStatus#UNSAFE} state with
 * a diagnostic reason:
 * <ul>
 *   <li>missing, non-JSON or non-object payload</li>
 *   <li>unknown state name</li>
 *   <li>a safe claim whose {@code changedAt} is present but unparsable</li>
 *   <li>a safe claim with no {@code changedAt} while a {@code priorChangedAt} exists
 *       (the switch was tripped and nothing records it being reset)</li>
 * </ul>
 *
 * <p>A safe claim is accepted only when {@code changedAt} parses, or when neither timestamp
 * is present (a switch that has never changed).
 */
public class SafetyStateParser {

    private static final Logger log = LoggerFactory.getLogger(SafetyStateParser.class);

    private final ObjectMapper objectMapper;

    public SafetyStateParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public SafetyState parse(SafetySwitch safetySwitch, String raw) {
        String name = safetySwitch.getDisplayName();
        if (raw == null || raw.isBlank()) {
            return SafetyState.unverified(safetySwitch, name + " state missing");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.warn("Invalid {} JSON, treating as unsafe: {}", name, e.getOriginalMessage());
            return SafetyState.unverified(safetySwitch, "Invalid " + name.toLowerCase() + " payload");
        }
        if (root == null || !root.isObject()) {
            log.warn("{} payload is not an object, treating as unsafe", name);
            return SafetyState.unverified(safetySwitch, "Invalid " + name.toLowerCase() + " payload");
        }
        return parse(safetySwitch, root);
    }

    public SafetyState parse(SafetySwitch safetySwitch, JsonNode root) {
        String name = safetySwitch.getDisplayName();
        JsonNode stateNode = root.get("state");
        if (stateNode == null || !stateNode.isTextual()) {
            log.warn("{} payload has no textual state, treating as unsafe", name);
            return SafetyState.unverified(safetySwitch, "Malformed " + name.toLowerCase() + " state");
        }
        String state = stateNode.asText().trim().toUpperCase(Locale.ROOT);

        String changedAtRaw = firstText(root, safetySwitch.getChangedAtFields());
        String priorChangedAtRaw = firstText(root, safetySwitch.getPriorChangedAtFields());
        Optional<Instant> changedAt = IsoTimestamps.parse(changedAtRaw);
        Optional<Instant> priorChangedAt = IsoTimestamps.parse(priorChangedAtRaw);
        String reason = firstText(root, safetySwitch.getReasonFields());

        if (state.equals(safetySwitch.getSafeState())) {
            if (changedAtRaw != null) {
                if (changedAt.isEmpty()) {
                    log.warn("{} {} with invalid {}: {}", name, state, safetySwitch.getChangedAtFields().get(0), changedAtRaw);
                    return SafetyState.unverified(
                            safetySwitch, state + " with invalid " + safetySwitch.getChangedAtFields().get(0));
                }
            } else if (priorChangedAtRaw != null) {
                log.warn(
                        "{} {} has {} but no {}, treating as unsafe",
                        name,
                        state,
                        safetySwitch.getPriorChangedAtFields().get(0),
                        safetySwitch.getChangedAtFields().get(0));
                return SafetyState.unverified(
                        safetySwitch, state + " missing " + safetySwitch.getChangedAtFields().get(0));
            }
            return SafetyState.builder()
                    .safetySwitch(safetySwitch)
                    .status(SafetyStatus.SAFE)
                    .changedAt(changedAt.orElse(null))
                    .priorChangedAt(priorChangedAt.orElse(null))
                    .verified(true)
                    .build();
        }

        if (state.equals(safetySwitch.getUnsafeState())) {
            return SafetyState.builder()
                    .safetySwitch(safetySwitch)
                    .status(SafetyStatus.UNSAFE)
                    .changedAt(changedAt.orElse(null))
                    .priorChangedAt(priorChangedAt.orElse(null))
                    .reason(reason)
                    .verified(true)
                    .build();
        }

        if (state.equals(safetySwitch.getTransitionalState())) {
            return SafetyState.builder()
                    .safetySwitch(safetySwitch)
                    .status(SafetyStatus.TRANSITIONAL)
                    .changedAt(changedAt.orElse(null))
                    .priorChangedAt(priorChangedAt.orElse(null))
                    .reason(reason)
                    .verified(true)
                    .build();
        }

        log.warn("Unknown {} state '{}', treating as unsafe", name, state);
        return SafetyState.unverified(safetySwitch, "Unknown " + name.toLowerCase() + " state '" + state + "'");
    }

    private static String firstText(JsonNode root, List<String> fields) {
        for (String field : fields) {
            JsonNode node = root.get(field);
            if (node == null || node.isNull()) {
                continue;
            }
            // non-text values are kept verbatim so a timestamp of the wrong type fails to parse
            String text = node.isTextual() ? node.asText() : node.toString();
            if (!text.isEmpty()) {
                return text;
            }
        }
        return null;
    }
}
