package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.RichestRoleRequest;
import com.flagship.casino_ledger.rank.GuildSettings;
import com.flagship.casino_ledger.rank.RankProjector;
import com.flagship.casino_ledger.rank.RankedUser;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/guilds/{guildId}")
@RequiredArgsConstructor
public class LeaderboardController {

    private final RankProjector rankProjector;

    @GetMapping("/leaderboard")
    public List<RankedUser> getLeaderboard(@PathVariable String guildId,
                                           @RequestParam(required = false) Integer limit) {
        return rankProjector.getTopUsers(guildId, limit);
    }

    @GetMapping("/players/{userId}/rank")
    public ResponseEntity<RankedUser> getRank(@PathVariable String guildId, @PathVariable String userId) {
        return rankProjector.getUserRank(userId, guildId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/settings/richest-role")
    public GuildSettings configureRichestRole(@PathVariable String guildId,
                                              @RequestBody RichestRoleRequest request) {
        return rankProjector.configureRichestRole(guildId, request.getRoleId());
    }
}
