package com.flagship.casino_ledger.api;

import com.flagship.casino_ledger.api.dto.WagerRequest;
import com.flagship.casino_ledger.game.slots.Jackpot;
import com.flagship.casino_ledger.game.slots.SlotSpinResult;
import com.flagship.casino_ledger.game.slots.SlotsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/guilds/{guildId}")
@RequiredArgsConstructor
public class SlotsController {

    private final SlotsService slotsService;

    @PostMapping("/players/{userId}/slots/spin")
    public SlotSpinResult spin(@PathVariable String guildId, @PathVariable String userId,
                               @Valid @RequestBody WagerRequest request) {
        return slotsService.spin(userId, guildId, request.getBet());
    }

    @GetMapping("/jackpot")
    public Jackpot getJackpot(@PathVariable String guildId) {
        return slotsService.getJackpot(guildId);
    }
}
