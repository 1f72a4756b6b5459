package com.fitcoach.backend.resolution.engine;

import com.fitcoach.backend.resolution.model.PlanRecord;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Comparator;

/**
 * plan 的「新舊」比較：先比 start_date，再比 created_at；有值的一律比 null 新。
 */
public final class PlanOrdering {
    private PlanOrdering() {}

    /** > 0 代表 a 比 b 新；0 代表兩個 key 都比不出來 */
    public static int compareRecency(LocalDate aStart, Instant aCreated, LocalDate bStart, Instant bCreated) {
        int c = nullsLow(aStart, bStart);
        if (c != 0) return c;
        return nullsLow(aCreated, bCreated);
    }

    public static <P> boolean isNewer(PlanRecord<P> candidate, PlanRecord<P> incumbent) {
        return compareRecency(
                candidate.startDate(), candidate.createdAt(),
                incumbent.startDate(), incumbent.createdAt()) > 0;
    }

    /** 新到舊、null 排最後；List.sort 是 stable，完全平手維持原順序 */
    public static <P> Comparator<PlanRecord<P>> newestFirst() {
        return (a, b) -> compareRecency(b.startDate(), b.createdAt(), a.startDate(), a.createdAt());
    }

    private static <T extends Comparable<? super T>> int nullsLow(T a, T b) {
        if (a == null && b == null) return 0;
        if (a == null) return -1;
        if (b == null) return 1;
        return a.compareTo(b);
    }
}
