package com.kickoff.tipping.service;

import com.kickoff.tipping.model.Tip;
import com.kickoff.tipping.repository.TipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
public class TipScoringService {
    private static final Logger log = LoggerFactory.getLogger(TipScoringService.class);

    private final TipRepository tipRepository;

    public TipScoringService(TipRepository tipRepository) {
        this.tipRepository = tipRepository;
    }

    /**
     * Re-marks every tip on a completed fixture: 1 when the pick equals the winner, otherwise 0.
     * Tips on unfinished fixtures keep their current value.
     * @return tips visited
     */
    @Transactional
    public int rescoreAll() {
        List<Tip> tips = tipRepository.findScorable();
        for (Tip tip : tips) {
            String winner = tip.getFixture().getWinner();
            tip.setPointsAwarded(winner.equals(tip.getTipTeam()) ? 1 : 0);
        }
        tipRepository.saveAll(tips);
        log.debug("[SCORES] rescored {} tips", tips.size());
        return tips.size();
    }
}
