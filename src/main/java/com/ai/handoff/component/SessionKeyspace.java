package com.ai.handoff.component;

import com.ai.handoff.conversation.SessionRef;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Owns every key name the coordination store sees.
 *
 * <p>Session keys are channel-qualified so one number arriving on two channels never
 * collides. Keys written before channels existed carry only the identity; they are
 * read as a fallback and never written again, so they retire through their TTL.
 */
@Component
public class SessionKeyspace {

    public static final String STATE_PREFIX = "conv_state:";
    public static final String META_PREFIX = "conv_meta:";
    public static final String BUFFER_PREFIX = "msg_buffer:";
    public static final String LOCK_PREFIX = "msg_lock:";
    public static final String PROCESSING_PREFIX = "msg_processing:";
    public static final String APPOINTMENT_PREFIX = "appointment:";
    public static final String APPOINTMENT_INDEX = "appointment_index";
    public static final String ROTATION_PREFIX = "lead_assigner:index:";
    public static final String ORPHAN_ALERTS = "lead_assigner:orphan_alerts";

    public String stateKey(SessionRef ref) {
        return STATE_PREFIX + ref;
    }

    public String metaKey(SessionRef ref) {
        return META_PREFIX + ref;
    }

    public String legacyStateKey(SessionRef ref) {
        return STATE_PREFIX + ref.identity();
    }

    public String legacyMetaKey(SessionRef ref) {
        return META_PREFIX + ref.identity();
    }

    /** Qualified key first, then the legacy one. */
    public List<String> stateReadOrder(SessionRef ref) {
        return List.of(stateKey(ref), legacyStateKey(ref));
    }

    public List<String> metaReadOrder(SessionRef ref) {
        return List.of(metaKey(ref), legacyMetaKey(ref));
    }

    public String bufferKey(SessionRef ref) {
        return BUFFER_PREFIX + ref;
    }

    public String lockKey(SessionRef ref) {
        return LOCK_PREFIX + ref;
    }

    public String processingKey(SessionRef ref) {
        return PROCESSING_PREFIX + ref;
    }

    public String appointmentKey(SessionRef ref) {
        return APPOINTMENT_PREFIX + ref;
    }

    public String rotationKey(String team) {
        return ROTATION_PREFIX + team;
    }
}
