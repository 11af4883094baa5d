package com.flagship.casino_ledger.rank;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Stand-in adapter for deployments without a chat platform connection: it
 * records the role change it would have made.
 */
@Component
@Slf4j
public class LoggingRoleAssignmentPort implements RoleAssignmentPort {

    @Override
    public void transferRole(String guildId, String roleId, String previousHolderId, String newHolderId) {
        log.info("Richest member role change: guildId={}, roleId={}, from={}, to={}",
                guildId, roleId, previousHolderId, newHolderId);
    }
}
