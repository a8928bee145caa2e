package com.cropalert.engine.support;

import com.cropalert.model.DebugRecord;

import java.time.LocalDate;

/**
 * Remote-sensing support picked for one target day. {@code supportDate} is null when nothing qualified.
 */
public final class SupportWindow {
    public final LocalDate date;
    public final LocalDate supportDate;
    public final int age;
    public final boolean windowOk;

    public SupportWindow(LocalDate date, LocalDate supportDate, int age, boolean windowOk) {
        this.date = date;
        this.supportDate = supportDate;
        this.age = age;
        this.windowOk = windowOk;
    }

    public static SupportWindow none(LocalDate date) {
        return new SupportWindow(date, null, DebugRecord.NO_SUPPORT_AGE, false);
    }

    @Override
    public String toString() {
        return date + " -> " + (supportDate == null ? "none" : supportDate + " (age " + age + ")");
    }
}
