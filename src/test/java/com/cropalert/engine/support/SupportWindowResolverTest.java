package com.cropalert.engine.support;

import com.cropalert.config.SupportPick;
import com.cropalert.config.WindowMode;
import com.cropalert.config.WindowSettings;
import com.cropalert.model.DailyRecord;
import com.cropalert.model.DebugRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SupportWindowResolverTest {

    private static final LocalDate D1 = LocalDate.of(2024, 5, 1);

    @Test
    void resolveDay_preferPastShouldTakePastOnTie() {
        SupportWindow window = resolver(5, WindowMode.SYMMETRIC, SupportPick.PREFER_PAST)
                .resolveDay(D1.plusDays(2), observations(D1, D1.plusDays(4)));

        assertEquals(D1, window.supportDate);
        assertEquals(2, window.age);
        assertTrue(window.windowOk);
    }

    @Test
    void resolveDay_nearestShouldTakeFutureOnTie() {
        SupportWindow window = resolver(5, WindowMode.SYMMETRIC, SupportPick.NEAREST)
                .resolveDay(D1.plusDays(2), observations(D1, D1.plusDays(4)));

        assertEquals(D1.plusDays(4), window.supportDate);
        assertEquals(2, window.age);
    }

    @Test
    void resolveDay_closerFutureShouldWinOverPast() {
        SupportWindow window = resolver(5, WindowMode.SYMMETRIC, SupportPick.PREFER_PAST)
                .resolveDay(D1.plusDays(5), observations(D1, D1.plusDays(6)));

        assertEquals(D1.plusDays(6), window.supportDate);
        assertEquals(1, window.age);
    }

    @Test
    void resolveDay_pastOnlyShouldIgnoreFutureObservations() {
        SupportWindowResolver resolver = resolver(5, WindowMode.PAST_ONLY, SupportPick.PREFER_PAST);

        SupportWindow noPast = resolver.resolveDay(D1, observations(D1.plusDays(1)));
        SupportWindow withPast = resolver.resolveDay(D1.plusDays(3), observations(D1, D1.plusDays(4)));

        assertNull(noPast.supportDate);
        assertEquals(DebugRecord.NO_SUPPORT_AGE, noPast.age);
        assertFalse(noPast.windowOk);
        assertEquals(D1, withPast.supportDate);
        assertEquals(3, withPast.age);
    }

    @Test
    void resolveDay_shouldRejectObservationsOutsideHalfWidth() {
        SupportWindowResolver resolver = resolver(3, WindowMode.SYMMETRIC, SupportPick.PREFER_PAST);

        SupportWindow edge = resolver.resolveDay(D1.plusDays(3), observations(D1));
        SupportWindow beyond = resolver.resolveDay(D1.plusDays(4), observations(D1));

        assertTrue(edge.windowOk);
        assertEquals(3, edge.age);
        assertFalse(beyond.windowOk);
        assertEquals(DebugRecord.NO_SUPPORT_AGE, beyond.age);
    }

    @Test
    void resolve_shouldUseRealObservationDaysOnly() {
        List<DailyRecord> records = List.of(
                DailyRecord.builder().date(D1).ndviFill(0.5).build(),
                DailyRecord.builder().date(D1.plusDays(1)).eviObs(0.4).eviFill(0.4).build(),
                DailyRecord.builder().date(D1.plusDays(2)).ndviFill(0.5).build()
        );

        List<SupportWindow> windows = resolver(5, WindowMode.SYMMETRIC, SupportPick.PREFER_PAST).resolve(records);

        assertEquals(3, windows.size());
        assertEquals(D1.plusDays(1), windows.get(0).supportDate);
        assertEquals(0, windows.get(1).age);
        assertEquals(D1.plusDays(1), windows.get(2).supportDate);
    }

    @Test
    void observationDates_shouldSkipNonFiniteObservedValues() {
        List<DailyRecord> records = List.of(
                DailyRecord.builder().date(D1).ndviObs(Double.POSITIVE_INFINITY).build(),
                DailyRecord.builder().date(D1.plusDays(1)).msiObs(Double.NEGATIVE_INFINITY).eviObs(0.4).build(),
                DailyRecord.builder().date(D1.plusDays(2)).ndmiObs(Double.NEGATIVE_INFINITY).build()
        );

        NavigableSet<LocalDate> dates = SupportWindowResolver.observationDates(records);

        assertEquals(new TreeSet<>(List.of(D1.plusDays(1))), dates);
        assertFalse(records.get(0).realObservation());
        assertTrue(records.get(1).realObservation());
    }

    private static SupportWindowResolver resolver(int halfDays, WindowMode mode, SupportPick pick) {
        return new SupportWindowResolver(new WindowSettings(halfDays, mode, pick));
    }

    private static NavigableSet<LocalDate> observations(LocalDate... dates) {
        return new TreeSet<>(List.of(dates));
    }
}
