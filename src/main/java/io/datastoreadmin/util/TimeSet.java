package io.datastoreadmin.util;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * A set of instants, represented as a normalized list of non-overlapping, non-adjacent closed ranges.
 * A {@code null} range bound means the range is unbounded on that side.
 *
 * Instants are treated with millisecond granularity: an exclusive bound such as {@code lt: t}
 * is stored as the inclusive bound {@code t - 1ms}.
 */
public final class TimeSet {

    static final Duration CONSECUTIVE_TIME_INCREMENT = Duration.ofMillis(1);

    public static final TimeSet ALL = new TimeSet(List.of(new Range(null, null)));
    public static final TimeSet EMPTY = new TimeSet(List.of());

    private final List<Range> ranges;

    private TimeSet(List<Range> ranges) {
        this.ranges = List.copyOf(ranges);
    }

    /**
     * Builds the half-open interval {@code [gte, lt)}. Either bound may be {@code null}.
     */
    public static TimeSet ofRange(Instant gte, Instant lt) {
        return ofBounds(null, gte, lt, null);
    }

    /**
     * Builds a time set from range predicates. At most one lower bound ({@code gt}/{@code gte})
     * and one upper bound ({@code lt}/{@code lte}) may be provided.
     */
    public static TimeSet ofBounds(Instant gt, Instant gte, Instant lt, Instant lte) {
        if (gt != null && gte != null) {
            throw new IllegalArgumentException(
                "TimeSet got two lower bounds, but can have only one (gt: " + gt + ", gte: " + gte + ")");
        }
        if (lt != null && lte != null) {
            throw new IllegalArgumentException(
                "TimeSet got two upper bounds, but can have only one (lt: " + lt + ", lte: " + lte + ")");
        }

        Instant lowerBound = gt != null ? gt.plus(CONSECUTIVE_TIME_INCREMENT) : gte;
        Instant upperBound = lt != null ? lt.minus(CONSECUTIVE_TIME_INCREMENT) : lte;

        Range range = Range.nonEmpty(lowerBound, upperBound);
        return range == null ? EMPTY : ofRanges(List.of(range));
    }

    public static TimeSet ofTimes(Collection<Instant> times) {
        return ofRanges(times.stream().map(t -> new Range(t, t)).collect(Collectors.toList()));
    }

    static TimeSet ofRanges(Collection<Range> ranges) {
        List<Range> normalized = normalize(ranges);
        if (normalized.isEmpty()) {
            return EMPTY;
        }
        if (normalized.size() == 1 && normalized.get(0).isUnbounded()) {
            return ALL;
        }
        return new TimeSet(normalized);
    }

    public boolean contains(Instant time) {
        return ranges.stream().anyMatch(r -> r.covers(time));
    }

    public boolean intersects(TimeSet other) {
        for (Range r1 : ranges) {
            for (Range r2 : other.ranges) {
                if (r1.intersect(r2) != null) {
                    return true;
                }
            }
        }
        return false;
    }

    public TimeSet intersection(TimeSet other) {
        List<Range> intersected = new ArrayList<>();
        for (Range r1 : ranges) {
            for (Range r2 : other.ranges) {
                Range r = r1.intersect(r2);
                if (r != null) {
                    intersected.add(r);
                }
            }
        }
        return ofRanges(intersected);
    }

    public TimeSet union(TimeSet other) {
        List<Range> all = new ArrayList<>(ranges);
        all.addAll(other.ranges);
        return ofRanges(all);
    }

    public TimeSet minus(TimeSet other) {
        List<Range> remaining = new ArrayList<>(ranges);

        for (Range otherRange : other.ranges) {
            List<Range> next = new ArrayList<>();
            for (Range selfRange : remaining) {
                if (selfRange.intersect(otherRange) == null) {
                    next.add(selfRange);
                    continue;
                }
                if (otherRange.begin() != null) {
                    addIfNonEmpty(next, selfRange.begin(), otherRange.begin().minus(CONSECUTIVE_TIME_INCREMENT));
                }
                if (otherRange.end() != null) {
                    addIfNonEmpty(next, otherRange.end().plus(CONSECUTIVE_TIME_INCREMENT), selfRange.end());
                }
            }
            remaining = next;
        }

        return ofRanges(remaining);
    }

    public TimeSet negate() {
        return ALL.minus(this);
    }

    public boolean isEmpty() {
        return ranges.isEmpty();
    }

    public List<Range> getRanges() {
        return ranges;
    }

    private static void addIfNonEmpty(List<Range> target, Instant begin, Instant end) {
        Range range = Range.nonEmpty(begin, end);
        if (range != null) {
            target.add(range);
        }
    }

    private static List<Range> normalize(Collection<Range> ranges) {
        List<Range> sorted = ranges.stream()
            .filter(r -> !r.isDescending())
            .sorted(Comparator.comparing(Range::begin, Comparator.nullsFirst(Comparator.naturalOrder())))
            .collect(Collectors.toList());

        List<Range> merged = new ArrayList<>();
        for (Range range : sorted) {
            if (!merged.isEmpty()) {
                Range last = merged.get(merged.size() - 1);
                if (last.overlapsOrAdjoins(range)) {
                    merged.set(merged.size() - 1, last.span(range));
                    continue;
                }
            }
            merged.add(range);
        }
        return merged;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSet)) return false;
        return ranges.equals(((TimeSet) o).ranges);
    }

    @Override
    public int hashCode() {
        return ranges.hashCode();
    }

    @Override
    public String toString() {
        return "TimeSet" + ranges;
    }

    /**
     * A closed range of instants. A {@code null} bound is unbounded.
     */
    public record Range(Instant begin, Instant end) {

        static Range nonEmpty(Instant begin, Instant end) {
            if (begin == null || end == null || !begin.isAfter(end)) {
                return new Range(begin, end);
            }
            return null;
        }

        boolean covers(Instant time) {
            return (begin == null || !time.isBefore(begin)) && (end == null || !time.isAfter(end));
        }

        boolean isUnbounded() {
            return begin == null && end == null;
        }

        boolean isDescending() {
            return begin != null && end != null && begin.isAfter(end);
        }

        Range intersect(Range other) {
            Instant newBegin = begin == null ? other.begin : (other.begin == null ? begin : max(begin, other.begin));
            Instant newEnd = end == null ? other.end : (other.end == null ? end : min(end, other.end));
            return nonEmpty(newBegin, newEnd);
        }

        // Assumes this range begins at or before the other.
        boolean overlapsOrAdjoins(Range other) {
            if (end == null || other.begin == null) {
                return true;
            }
            return !end.plus(CONSECUTIVE_TIME_INCREMENT).isBefore(other.begin);
        }

        Range span(Range other) {
            Instant newBegin = begin == null || other.begin == null ? null : min(begin, other.begin);
            Instant newEnd = end == null || other.end == null ? null : max(end, other.end);
            return new Range(newBegin, newEnd);
        }

        private static Instant min(Instant a, Instant b) {
            return a.isBefore(b) ? a : b;
        }

        private static Instant max(Instant a, Instant b) {
            return a.isAfter(b) ? a : b;
        }

        @Override
        public String toString() {
            return "[" + Objects.toString(begin, "-inf") + ", " + Objects.toString(end, "+inf") + "]";
        }
    }
}
