package com.notevault.backup.restore;

/** The legacy notes payload of one restored workspace, handed back to the client verbatim. */
public record RestoredPayload(String workspaceId, String payload) {}
