package com.flagship.casino_ledger.rank;

/**
 * Grants and revokes the richest-member role on the chat platform.
 */
public interface RoleAssignmentPort {

    /**
     * Moves the role. {@code previousHolderId} is null when nobody held it.
     */
    void transferRole(String guildId, String roleId, String previousHolderId, String newHolderId);
}
