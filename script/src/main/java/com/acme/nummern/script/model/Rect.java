package com.acme.nummern.script.model;

public record Rect(double x, double y, double width, double height) {
    public static final Rect ZERO = new Rect(0, 0, 0, 0);

    public Rect withPosition(double newX, double newY) {
        return new Rect(newX, newY, width, height);
    }
}
