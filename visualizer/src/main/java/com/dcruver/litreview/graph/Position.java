package com.dcruver.litreview.graph;

import lombok.Value;

@Value
public class Position {
    double x;
    double y;

    public Position offset(double dx, double dy) {
        return new Position(x + dx, y + dy);
    }
}
