package com.synclab.laddersim.engine.state;

/**
 * Accumulator and status bits of one counter tag (DINT range).
 */
public class CounterState {

    private int acc;
    private int pre;
    private boolean cu;
    private boolean cd;
    private boolean dn;
    private boolean ov;
    private boolean un;

    public CounterState(int pre) {
        this(0, pre, false, false, false, false, false);
    }

    public CounterState(int acc, int pre, boolean cu, boolean cd, boolean dn, boolean ov, boolean un) {
        this.acc = acc;
        this.pre = pre;
        this.cu = cu;
        this.cd = cd;
        this.dn = dn;
        this.ov = ov;
        this.un = un;
    }

    public CounterState copy() {
        return new CounterState(acc, pre, cu, cd, dn, ov, un);
    }

    /** Clears the accumulator and the done/overflow/underflow bits, as RES does. */
    public void reset() {
        acc = 0;
        dn = false;
        ov = false;
        un = false;
    }

    /** Adds one, wrapping at the top of the range and latching OV. */
    public void countUp() {
        if (acc == Integer.MAX_VALUE) {
            acc = Integer.MIN_VALUE;
            ov = true;
        } else {
            acc++;
        }
        dn = acc >= pre;
    }

    /** Subtracts one, wrapping at the bottom of the range and latching UN. */
    public void countDown() {
        if (acc == Integer.MIN_VALUE) {
            acc = Integer.MAX_VALUE;
            un = true;
        } else {
            acc--;
        }
        dn = acc >= pre;
    }

    public int getAcc() {
        return acc;
    }

    public void setAcc(int acc) {
        this.acc = acc;
        this.dn = acc >= pre;
    }

    public int getPre() {
        return pre;
    }

    public void setPre(int pre) {
        this.pre = pre;
        this.dn = acc >= pre;
    }

    public boolean isCu() {
        return cu;
    }

    public void setCu(boolean cu) {
        this.cu = cu;
    }

    public boolean isCd() {
        return cd;
    }

    public void setCd(boolean cd) {
        this.cd = cd;
    }

    public boolean isDn() {
        return dn;
    }

    public boolean isOv() {
        return ov;
    }

    public boolean isUn() {
        return un;
    }

    public Double member(String member) {
        if (member == null) {
            return (double) acc;
        }
        switch (member) {
            case "ACC":
                return (double) acc;
            case "PRE":
                return (double) pre;
            case "CU":
                return cu ? 1.0 : 0.0;
            case "CD":
                return cd ? 1.0 : 0.0;
            case "DN":
                return dn ? 1.0 : 0.0;
            case "OV":
                return ov ? 1.0 : 0.0;
            case "UN":
                return un ? 1.0 : 0.0;
            default:
                return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CounterState)) return false;
        CounterState that = (CounterState) o;
        return acc == that.acc && pre == that.pre && cu == that.cu && cd == that.cd
                && dn == that.dn && ov == that.ov && un == that.un;
    }

    @Override
    public int hashCode() {
        int result = acc;
        result = 31 * result + pre;
        result = 31 * result + (cu ? 1 : 0);
        result = 31 * result + (cd ? 1 : 0);
        result = 31 * result + (dn ? 1 : 0);
        result = 31 * result + (ov ? 1 : 0);
        result = 31 * result + (un ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        return String.format("Counter{ACC=%d, PRE=%d, CU=%s, CD=%s, DN=%s, OV=%s, UN=%s}",
                acc, pre, cu, cd, dn, ov, un);
    }
}
