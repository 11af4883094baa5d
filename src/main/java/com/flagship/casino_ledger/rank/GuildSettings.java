package com.flagship.casino_ledger.rank;

import lombok.Value;

@Value
public class GuildSettings {
    String guildId;
    String guildName;
    String richestMemberRoleId;
    String richestMemberId;

    public boolean hasRichestRole() {
        return richestMemberRoleId != null && !richestMemberRoleId.isBlank();
    }
}
