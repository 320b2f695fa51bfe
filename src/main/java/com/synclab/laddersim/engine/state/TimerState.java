package com.synclab.laddersim.engine.state;

/**
 * Accumulator and status bits of one timer tag. Times are in milliseconds.
 */
public class TimerState {

    private long acc;
    private long pre;
    private boolean en;
    private boolean tt;
    private boolean dn;

    public TimerState(long pre) {
        this(0L, pre, false, false, false);
    }

    public TimerState(long acc, long pre, boolean en, boolean tt, boolean dn) {
        this.acc = Math.max(0L, acc);
        this.pre = Math.max(0L, pre);
        this.en = en;
        this.tt = tt;
        this.dn = dn;
    }

    public TimerState copy() {
        return new TimerState(acc, pre, en, tt, dn);
    }

    /** Clears the accumulator and every status bit, as RES does. */
    public void reset() {
        acc = 0L;
        en = false;
        tt = false;
        dn = false;
    }

    public long getAcc() {
        return acc;
    }

    public void setAcc(long acc) {
        this.acc = Math.max(0L, acc);
    }

    public long getPre() {
        return pre;
    }

    public void setPre(long pre) {
        this.pre = Math.max(0L, pre);
    }

    public boolean isEn() {
        return en;
    }

    public void setEn(boolean en) {
        this.en = en;
    }

    public boolean isTt() {
        return tt;
    }

    public void setTt(boolean tt) {
        this.tt = tt;
    }

    public boolean isDn() {
        return dn;
    }

    public void setDn(boolean dn) {
        this.dn = dn;
    }

    /** Status bit or word by member name; {@code null} for an unknown member. */
    public Double member(String member) {
        if (member == null) {
            return (double) acc;
        }
        switch (member) {
            case "ACC":
                return (double) acc;
            case "PRE":
                return (double) pre;
            case "EN":
                return en ? 1.0 : 0.0;
            case "TT":
                return tt ? 1.0 : 0.0;
            case "DN":
                return dn ? 1.0 : 0.0;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimerState)) return false;
        TimerState that = (TimerState) o;
        return acc == that.acc && pre == that.pre && en == that.en && tt == that.tt && dn == that.dn;
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(acc);
        result = 31 * result + Long.hashCode(pre);
        result = 31 * result + (en ? 1 : 0);
        result = 31 * result + (tt ? 1 : 0);
        result = 31 * result + (dn ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Timer{ACC=%d, PRE=%d, EN=%s, TT=%s, DN=%s}", acc, pre, en, tt, dn);
    }
}
