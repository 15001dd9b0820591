package com.openforge.recall.retrieval;

import com.openforge.recall.persona.PersonaState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which lanes a turn may draw from.
 *
 *   zone     chaos   RUMOR admitted
 *   NORMAL   ≤ 70    none
 *   THEATER  ≤ 70    best 3 (performance mode)
 *   THEATER  > 70    all
 *
 * THEATER means chaos above the threshold or a PODCAST / STREAMING mode.
 * CANON entries need confidence ≥ 60 in every zone.  Raising chaos never
 * admits fewer rumors.  Pure; order of the input ranking is preserved.
 */
@Slf4j
@Component
public class TheaterZonePolicy {

    private final int chaosThreshold;
    private final int rumorCap;
    private final int minCanonConfidence;

    @Autowired
    public TheaterZonePolicy(RetrievalProperties props) {
        this(props.chaosThreshold(), props.rumorCap(), props.minCanonConfidence());
    }

    public TheaterZonePolicy(int chaosThreshold, int rumorCap, int minCanonConfidence) {
        this.chaosThreshold     = chaosThreshold;
        this.rumorCap           = rumorCap;
        this.minCanonConfidence = minCanonConfidence;
    }

    /**
     * @param zone           zone the turn ran in
     * @param admitted       surviving candidates, in input order
     * @param rumorsAdmitted RUMOR entries among them
     * @param rejected       candidates filtered out
     */
    public record Admission(ZoneState zone, List<RankedCandidate> admitted, int rumorsAdmitted, int rejected) {}

    public ZoneState classify(PersonaState persona) {
        return persona.chaosLevel() > chaosThreshold || persona.mode().isPerformance()
                ? ZoneState.THEATER
                : ZoneState.NORMAL;
    }

    /** How many RUMOR entries the persona state allows. */
    public int rumorAllowance(PersonaState persona) {
        if (classify(persona) == ZoneState.NORMAL) return 0;
        return persona.chaosLevel() > chaosThreshold ? Integer.MAX_VALUE : rumorCap;
    }

    public Admission admit(List<RankedCandidate> ranked, PersonaState persona) {
        ZoneState zone = classify(persona);
        int allowance  = rumorAllowance(persona);

        List<RankedCandidate> admitted = new ArrayList<>(ranked.size());
        int rumors = 0, rejected = 0;
        for (RankedCandidate rc : ranked) {
            if (rc.memory().isCanon()) {
                if (rc.memory().confidence() >= minCanonConfidence) admitted.add(rc);
                else rejected++;
            } else if (rumors < allowance) {
                admitted.add(rc);
                rumors++;
            } else {
                rejected++;
            }
        }
        log.debug("[Retrieval] zone={} chaos={} mode={} admitted={} rumors={} rejected={}",
                zone, persona.chaosLevel(), persona.mode(), admitted.size(), rumors, rejected);
        return new Admission(zone, List.copyOf(admitted), rumors, rejected);
    }
}
