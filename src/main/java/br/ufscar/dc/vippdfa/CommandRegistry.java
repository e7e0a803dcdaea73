package br.ufscar.dc.vippdfa;

import java.util.HashMap;
import java.util.Map;

/** Tabela de palavras-chave VIPP com a aridade de cada uma */
public final class CommandRegistry {

    public enum Trailing {
        NONE,
        SPACING, // NL com espaçamento numérico opcional
        SCALE,   // SCALL/ICALL com escala opcional
        INI_FLAG // SETVAR com /INI opcional
    }

    public static final class CommandSpec {
        private final CommandKind kind;
        private final int arity;
        private final Trailing trailing;

        CommandSpec(CommandKind kind, int arity, Trailing trailing) {
            this.kind = kind;
            this.arity = arity;
            this.trailing = trailing;
        }

        public CommandKind getKind() {
            return kind;
        }

        public int getArity() {
            return arity;
        }

        public Trailing getTrailing() {
            return trailing;
        }
    }

    private static final Map<String, CommandSpec> COMMANDS = new HashMap<>();
    private static final Map<String, Integer> OPERATORS = new HashMap<>();

    static {
        for (String sh : new String[] {"SH", "SHL", "SHR", "SHr", "SHC", "SHJ"}) {
            register(sh, CommandKind.SHOW, 1);
        }
        register("SHP", CommandKind.SHOW_PARAGRAPH, 3);
        register("SHROW", CommandKind.TABLE_ROW, 1);
        register("MOVETO", CommandKind.MOVE_TO, 2);
        register("MOVEH", CommandKind.MOVE_H, 1);
        COMMANDS.put("NL", new CommandSpec(CommandKind.NEW_LINE, 0, Trailing.SPACING));
        register("SETLSP", CommandKind.SET_LINE_SPACING, 1);
        register("SETUNIT", CommandKind.SET_UNIT, 1);
        for (String o : new String[] {"ORITL", "PORT", "LAND", "IPORT", "ILAND"}) {
            register(o, CommandKind.SET_ORIENTATION, 0);
        }
        register("SETTXC", CommandKind.SET_COLOR, 1);
        register("INDEXFONT", CommandKind.DEFINE_FONT, 3);
        register("INDEXCOLOR", CommandKind.DEFINE_COLOR, 2);
        COMMANDS.put("SETVAR", new CommandSpec(CommandKind.SET_VARIABLE, 2, Trailing.INI_FLAG));
        register("++", CommandKind.INCREMENT, 1);
        register("--", CommandKind.DECREMENT, 1);
        register("DRAWB", CommandKind.DRAW_BOX, 5);
        COMMANDS.put("SCALL", new CommandSpec(CommandKind.CALL_SEGMENT, 1, Trailing.SCALE));
        COMMANDS.put("ICALL", new CommandSpec(CommandKind.CALL_IMAGE, 1, Trailing.SCALE));
        register("SETFORM", CommandKind.LOAD_FORM, 1);
        register("SETLKF", CommandKind.LINK_FRAME, 1);
        register("SETPAGEDEF", CommandKind.PAGE_DEFINITION, 1);
        for (String p : new String[] {"PAGEBRK", "NEWFRAME", "SKIPPAGE", "ENDPAGE"}) {
            register(p, CommandKind.PAGE_BREAK, 0);
        }
        register("BOOKMARK", CommandKind.BOOKMARK, 1);
        register("SETDBSEP", CommandKind.DATA_SEPARATOR, 1);
        register("SETPROJECT", CommandKind.DIRECTIVE, 1);
        for (String d : new String[] {"STARTDBM", "ENDJOB", "XGF"}) {
            register(d, CommandKind.DIRECTIVE, 0);
        }
        register("XGFRESDEF", CommandKind.SUBROUTINE, 2);
        register("BEGINPAGE", CommandKind.PAGE_HOOK, 1);
        register("FSHOW", CommandKind.FORM, 1);
        register("REPEAT", CommandKind.REPEAT, 2);

        // reconhecidos, sem tradução direta
        register("CLIP", CommandKind.UNSUPPORTED, 4);
        register("ENDCLIP", CommandKind.UNSUPPORTED, 0);
        register("SETPAGENUMBER", CommandKind.UNSUPPORTED, 5);
        register("INDEXBAT", CommandKind.UNSUPPORTED, 2);
        register("SETFTSW", CommandKind.UNSUPPORTED, 2);
        register("SETPARAMS", CommandKind.UNSUPPORTED, 1);
        register("FOR", CommandKind.UNSUPPORTED, 5);
        register("SETMAXFORM", CommandKind.UNSUPPORTED, 1);
        register("SETBUFSIZE", CommandKind.UNSUPPORTED, 1);

        for (String cmp : new String[] {"eq", "ne", "lt", "gt", "le", "ge", "and", "or", "add", "sub", "mul", "div"}) {
            OPERATORS.put(cmp, 2);
        }
        OPERATORS.put("not", 1);
        OPERATORS.put("VSUB", 1);
        OPERATORS.put("GETINTV", 3);
        OPERATORS.put("GETITEM", 2);
        OPERATORS.put("CACHE", 1);
    }

    private CommandRegistry() {
    }

    private static void register(String keyword, CommandKind kind, int arity) {
        COMMANDS.put(keyword, new CommandSpec(kind, arity, Trailing.NONE));
    }

    public static CommandSpec lookup(String keyword) {
        return COMMANDS.get(keyword);
    }

    public static boolean isOperator(String word) {
        return OPERATORS.containsKey(word);
    }

    public static int operatorArity(String word) {
        return OPERATORS.get(word);
    }

    /** Palavras estruturais tratadas diretamente pelo parser */
    public static boolean isStructural(String word) {
        switch (word) {
            case "IF":
            case "IFELSE":
            case "THEN":
            case "ELSE":
            case "ENDIF":
            case "CASE":
            case "ENDCASE":
            case "BEGINTABLE":
            case "ENDTABLE":
                return true;
            default:
                return false;
        }
    }
}
