package br.ufscar.dc.vippdfa;

public enum CommandKind {
    SHOW,
    SHOW_PARAGRAPH,
    TABLE_ROW,
    MOVE_TO,
    MOVE_H,
    NEW_LINE,
    SET_LINE_SPACING,
    SET_UNIT,
    SET_ORIENTATION,
    SET_FONT,
    SET_COLOR,
    DEFINE_FONT,
    DEFINE_COLOR,
    SET_VARIABLE,
    INCREMENT,
    DECREMENT,
    DRAW_BOX,
    CALL_SEGMENT,
    CALL_IMAGE,
    LOAD_FORM,
    PAGE_DEFINITION,
    PAGE_LAYOUT,
    LINK_FRAME,
    PAGE_BREAK,
    BOOKMARK,
    DATA_SEPARATOR,
    DIRECTIVE,
    IF,
    THEN_BRANCH,
    ELSE_BRANCH,
    CASE,
    CASE_ENTRY,
    CASE_DEFAULT,
    SUBROUTINE,
    PAGE_HOOK,
    FORM,
    REPEAT,
    TABLE,
    UNSUPPORTED;

    public boolean isAssignment() {
        return this == SET_VARIABLE || this == INCREMENT || this == DECREMENT;
    }

    /** Comandos que produzem saída, desenho ou controle de página */
    public boolean isMeaningful() {
        switch (this) {
            case SHOW:
            case SHOW_PARAGRAPH:
            case TABLE_ROW:
            case NEW_LINE:
            case DRAW_BOX:
            case CALL_SEGMENT:
            case CALL_IMAGE:
            case PAGE_BREAK:
            case BOOKMARK:
            case CASE:
            case UNSUPPORTED:
                return true;
            default:
                return false;
        }
    }
}
