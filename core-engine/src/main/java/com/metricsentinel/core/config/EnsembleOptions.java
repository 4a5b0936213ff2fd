package com.metricsentinel.core.config;

import com.metricsentinel.core.model.Algorithm;

import java.io.Serializable;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Membership and voting policy for the ensemble coordinator.
 *
 * <p>
 * A point is anomalous when a strict majority of members vote anomalous. An
 * exact half split is resolved by {@link #getTieBreak()}, which defaults to
 * {@link TieBreakPolicy#FAVOR_PRECISION}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EnsembleOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Tie-break applied when none is configured. */
    public static final TieBreakPolicy DEFAULT_TIE_BREAK = TieBreakPolicy.FAVOR_PRECISION;

    private static final EnsembleOptions DEFAULTS = new EnsembleOptions(Algorithm.SINGLE, DEFAULT_TIE_BREAK);

    private final List<Algorithm> members;
    private final TieBreakPolicy tieBreak;

    /**
     * @param members  algorithms that vote; non-empty, no duplicates, must not
     *                 contain {@link Algorithm#ENSEMBLE}
     * @param tieBreak policy for an exact half split
     * @throws InvalidConfigException if the member list is invalid
     */
    public EnsembleOptions(List<Algorithm> members, TieBreakPolicy tieBreak) {
        Objects.requireNonNull(members, "ensemble members must not be null");
        if (members.isEmpty()) {
            throw new InvalidConfigException("ensemble requires at least one member algorithm");
        }
        if (members.contains(Algorithm.ENSEMBLE)) {
            throw new InvalidConfigException("ensemble cannot contain itself as a member");
        }
        Set<Algorithm> unique = new LinkedHashSet<>(members);
        if (unique.size() != members.size()) {
            throw new InvalidConfigException("ensemble members must be distinct, got: " + members);
        }
        this.members = List.copyOf(members);
        this.tieBreak = Objects.requireNonNull(tieBreak, "tieBreak must not be null");
    }

    public static EnsembleOptions defaults() {
        return DEFAULTS;
    }

    public List<Algorithm> getMembers() {
        return members;
    }

    public TieBreakPolicy getTieBreak() {
        return tieBreak;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof EnsembleOptions that))
            return false;
        return members.equals(that.members) && tieBreak == that.tieBreak;
    }

    @Override
    public int hashCode() {
        return Objects.hash(members, tieBreak);
    }

    @Override
    public String toString() {
        return "EnsembleOptions{members=" + members + ", tieBreak=" + tieBreak + '}';
    }
}
