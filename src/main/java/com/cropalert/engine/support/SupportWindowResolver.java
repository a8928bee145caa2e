package com.cropalert.engine.support;

import com.cropalert.config.SupportPick;
import com.cropalert.config.WindowMode;
import com.cropalert.config.WindowSettings;
import com.cropalert.model.DailyRecord;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableSet;
import java.util.TreeSet;

/**
 * 模块说明：SupportWindowResolver（class）。
 * 主要职责：为每个目标日挑选距离最近的真实遥感观测日，并给出支持日期、支持天数与窗口是否有效。
 * 实现要点：观测日期放入 TreeSet，用 floor/higher 各取一侧最近候选；等距时 prefer_past 取过去，nearest 取较晚的一侧。
 */
public final class SupportWindowResolver {
    private final WindowSettings settings;

    public SupportWindowResolver(WindowSettings settings) {
        this.settings = settings == null ? WindowSettings.defaults() : settings;
    }

    public List<SupportWindow> resolve(List<DailyRecord> records) {
        NavigableSet<LocalDate> observations = observationDates(records);
        List<SupportWindow> out = new ArrayList<>(records.size());
        for (DailyRecord record : records) {
            out.add(resolveDay(record.date, observations));
        }
        return out;
    }

    public static NavigableSet<LocalDate> observationDates(List<DailyRecord> records) {
        NavigableSet<LocalDate> dates = new TreeSet<>();
        for (DailyRecord record : records) {
            if (record.realObservation()) {
                dates.add(record.date);
            }
        }
        return dates;
    }

    public SupportWindow resolveDay(LocalDate day, NavigableSet<LocalDate> observations) {
        int halfDays = settings.halfDays;

        LocalDate past = observations.floor(day);
        long pastAge = past == null ? Long.MAX_VALUE : ChronoUnit.DAYS.between(past, day);
        if (pastAge > halfDays) {
            past = null;
        }

        LocalDate future = null;
        long futureAge = Long.MAX_VALUE;
        if (settings.mode == WindowMode.SYMMETRIC) {
            future = observations.higher(day);
            futureAge = future == null ? Long.MAX_VALUE : ChronoUnit.DAYS.between(day, future);
            if (futureAge > halfDays) {
                future = null;
            }
        }

        if (past == null && future == null) {
            return SupportWindow.none(day);
        }
        boolean takePast;
        if (future == null) {
            takePast = true;
        } else if (past == null) {
            takePast = false;
        } else if (pastAge != futureAge) {
            takePast = pastAge < futureAge;
        } else {
            takePast = settings.pick == SupportPick.PREFER_PAST;
        }
        LocalDate chosen = takePast ? past : future;
        int age = (int) (takePast ? pastAge : futureAge);
        return new SupportWindow(day, chosen, age, age <= halfDays);
    }
}
