package com.ryuqq.bay.core.spi;

import com.ryuqq.bay.core.model.Sandbox;
import com.ryuqq.bay.core.model.Session;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Label names attached to every instance and volume the control plane creates.
 *
 * <p>{@link #MANAGED} scopes orphan detection to resources this control plane owns;
 * instances without it are never touched.</p>
 *
 * @author Bay Team
 * @since 1.0.0
 */
public final class InstanceLabels {

    public static final String MANAGED = "bay.managed";
    public static final String OWNER = "bay.owner";
    public static final String SANDBOX_ID = "bay.sandbox_id";
    public static final String SESSION_ID = "bay.session_id";
    public static final String WORKSPACE_ID = "bay.workspace_id";
    public static final String PROFILE_ID = "bay.profile_id";

    private InstanceLabels() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Filter matching every instance the control plane owns.
     */
    public static Map<String, String> managedFilter() {
        return Map.of(MANAGED, "true");
    }

    /**
     * Labels for a session's compute instance.
     *
     * @param sandbox owning sandbox
     * @param session session being started
     * @return ordered label map
     */
    public static Map<String, String> forSession(Sandbox sandbox, Session session) {
        Map<String, String> labels = new LinkedHashMap<>();
        labels.put(MANAGED, "true");
        labels.put(OWNER, sandbox.owner());
        labels.put(SANDBOX_ID, sandbox.id().getValue());
        labels.put(SESSION_ID, session.id().getValue());
        labels.put(WORKSPACE_ID, sandbox.workspaceId().getValue());
        labels.put(PROFILE_ID, sandbox.profileId());
        return labels;
    }
}
