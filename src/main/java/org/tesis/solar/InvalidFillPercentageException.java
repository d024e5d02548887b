package org.tesis.solar;

public class InvalidFillPercentageException extends LayoutException {

    private final double fillPct;

    public InvalidFillPercentageException(double fillPct) {
        super("fillPct must be between " + LayoutParams.MIN_FILL_PCT + " and "
                + LayoutParams.MAX_FILL_PCT + ", got " + fillPct);
        this.fillPct = fillPct;
    }

    public double getFillPct() {
        return fillPct;
    }
}
