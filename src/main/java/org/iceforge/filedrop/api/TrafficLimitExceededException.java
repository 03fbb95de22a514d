package org.iceforge.filedrop.api;

import java.util.Locale;

public class TrafficLimitExceededException extends RuntimeException {

    public enum Direction { UPLOAD, DOWNLOAD }

    private final Direction direction;
    private final long limit;
    private final long used;

    public TrafficLimitExceededException(Direction direction, long limit, long used) {
        super("Daily " + direction.name().toLowerCase(Locale.ROOT) + " limit of " + limit + " bytes exceeded (used " + used + ")");
        this.direction = direction;
        this.limit = limit;
        this.used = used;
    }

    public Direction direction() { return direction; }
    public long limit() { return limit; }
    public long used() { return used; }
}
