package com.architecture.design.nodeforge.model.node;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class UnitValue {

    public enum Unit {
        PIXELS,
        PERCENT
    }

    private Unit unit;
    private double value;

    public static UnitValue pixels(double value) {
        return new UnitValue(Unit.PIXELS, value);
    }

    public static UnitValue percent(double value) {
        return new UnitValue(Unit.PERCENT, value);
    }
}
