package org.latex2typst;

public enum CellAlign {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right"),
    AUTO("auto");

    private final String typst;

    CellAlign(String typst) {
        this.typst = typst;
    }

    public String toTypst() {
        return typst;
    }

    // Column type letter from a tabular spec
    public static CellAlign fromSpec(String column) {
        return switch (column) {
            case "l" -> LEFT;
            case "c" -> CENTER;
            case "r" -> RIGHT;
            default -> AUTO;
        };
    }

    // Typst alignment name, as written inside table.cell(align: ...)
    public static CellAlign fromTypst(String name) {
        for (var align : values()) {
            if (align.typst.equals(name)) {
                return align;
            }
        }
        return AUTO;
    }
}
