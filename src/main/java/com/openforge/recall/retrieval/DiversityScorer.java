package com.openforge.recall.retrieval;

import com.openforge.recall.domain.MemoryType;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Second scoring pass that discourages redundant context.
 *
 * Walks the provisional ranking once.  Each candidate is penalised for every
 * candidate already walked: 0.1 if it has the same type, 0.2 if the two share
 * a keyword.  factor = max(0, 1 − penalty) multiplies the base score and the
 * list is re-sorted.  The top candidate always keeps factor 1.
 */
@Component
public class DiversityScorer {

    private final RetrievalProperties.Weights w;

    @Autowired
    public DiversityScorer(RetrievalProperties props) {
        this(props.weights());
    }

    public DiversityScorer(RetrievalProperties.Weights weights) {
        this.w = weights;
    }

    public List<RankedCandidate> diversify(List<RankedCandidate> provisional) {
        List<RankedCandidate> ordered = new ArrayList<>(provisional);
        ordered.sort(RankedCandidate.BY_RANK);

        Map<MemoryType, Integer> typeCounts = new EnumMap<>(MemoryType.class);
        List<Set<String>> acceptedKeywords = new ArrayList<>(ordered.size());
        List<RankedCandidate> out = new ArrayList<>(ordered.size());

        for (RankedCandidate rc : ordered) {
            MemoryType type = rc.memory().type();
            Set<String> keywords = rc.memory().keywords();

            double penalty = typeCounts.getOrDefault(type, 0) * w.sameTypePenalty();
            for (Set<String> other : acceptedKeywords) {
                if (!Collections.disjoint(keywords, other)) penalty += w.keywordOverlapPenalty();
            }
            out.add(rc.withDiversityFactor(Math.max(0.0, 1.0 - penalty)));

            typeCounts.merge(type, 1, Integer::sum);
            acceptedKeywords.add(keywords);
        }
        out.sort(RankedCandidate.BY_RANK);
        return out;
    }
}
