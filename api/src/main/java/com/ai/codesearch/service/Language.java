package com.ai.codesearch.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Languages with a structural splitter. Separators are tried in order, from
 * declaration boundaries down to single characters.
 */
public enum Language {

    PYTHON("\nclass ", "\ndef ", "\n\tdef "),
    JAVA("\nclass ", "\npublic ", "\nprotected ", "\nprivate ", "\nstatic ",
            "\nif ", "\nfor ", "\nwhile ", "\nswitch ", "\ncase "),
    KOTLIN("\nclass ", "\npublic ", "\nprotected ", "\nprivate ", "\ninternal ", "\ncompanion ",
            "\nfun ", "\nval ", "\nvar ", "\nif ", "\nfor ", "\nwhile ", "\nwhen ", "\ncase ", "\nelse "),
    JS("\nfunction ", "\nconst ", "\nlet ", "\nvar ", "\nclass ",
            "\nif ", "\nfor ", "\nwhile ", "\nswitch ", "\ncase ", "\ndefault "),
    TS("\nenum ", "\ninterface ", "\nnamespace ", "\ntype ", "\nclass ", "\nfunction ",
            "\nconst ", "\nlet ", "\nvar ", "\nif ", "\nfor ", "\nwhile ", "\nswitch ", "\ncase ", "\ndefault "),
    GO("\nfunc ", "\nvar ", "\nconst ", "\ntype ", "\nif ", "\nfor ", "\nswitch ", "\ncase "),
    RUST("\nfn ", "\nconst ", "\nlet ", "\nif ", "\nwhile ", "\nfor ", "\nloop ", "\nmatch "),
    CPP("\nclass ", "\nvoid ", "\nint ", "\nfloat ", "\ndouble ",
            "\nif ", "\nfor ", "\nwhile ", "\nswitch ", "\ncase "),
    C("\nvoid ", "\nint ", "\nfloat ", "\ndouble ", "\nstruct ",
            "\nif ", "\nfor ", "\nwhile ", "\nswitch ", "\ncase "),
    CSHARP("\ninterface ", "\nenum ", "\nimplements ", "\ndelegate ", "\nevent ", "\nclass ", "\nabstract ",
            "\npublic ", "\nprotected ", "\nprivate ", "\nstatic ", "\nreturn ", "\nif ", "\ncontinue ",
            "\nfor ", "\nforeach ", "\nwhile ", "\nswitch ", "\nbreak ", "\ncase ", "\nelse ",
            "\ntry ", "\nthrow ", "\nfinally ", "\ncatch "),
    RUBY("\ndef ", "\nclass ", "\nif ", "\nunless ", "\nwhile ", "\nfor ", "\ndo ", "\nbegin ", "\nrescue "),
    PHP("\nfunction ", "\nclass ", "\nif ", "\nforeach ", "\nwhile ", "\ndo ", "\nswitch ", "\ncase "),
    SCALA("\nclass ", "\nobject ", "\ndef ", "\nval ", "\nvar ", "\nif ", "\nfor ", "\nwhile ",
            "\nmatch ", "\ncase "),
    SWIFT("\nfunc ", "\nclass ", "\nstruct ", "\nenum ", "\nif ", "\nfor ", "\nwhile ", "\ndo ",
            "\nswitch ", "\ncase "),
    PROTO("\nmessage ", "\nservice ", "\nenum ", "\noption ", "\nimport ", "\nsyntax "),
    LUA("\nlocal ", "\nfunction ", "\nif ", "\nfor ", "\nwhile ", "\nrepeat "),
    PERL("\nsub ", "\npackage ", "\nmy ", "\nif ", "\nfor ", "\nwhile "),
    HASKELL("\nmain :: ", "\nmain = ", "\nlet ", "\nin ", "\ndo ", "\nwhere ", "\n:: ", "\n= ",
            "\ndata ", "\nnewtype ", "\ntype ", "\nmodule ", "\nimport ", "\nqualified ", "\nimport qualified ",
            "\nclass ", "\ninstance ", "\ncase ", "\n| "),
    ELIXIR("\ndef ", "\ndefp ", "\ndefmodule ", "\ndefprotocol ", "\ndefmacro ", "\ndefmacrop ",
            "\nif ", "\nunless ", "\nwhile ", "\ncase ", "\ncond ", "\nwith ", "\nfor ", "\ndo "),
    POWERSHELL("\nfunction ", "\nparam ", "\nif ", "\nforeach ", "\nfor ", "\nwhile ", "\nswitch ",
            "\nclass ", "\ntry ", "\ncatch ", "\nfinally "),
    MARKDOWN("\n# ", "\n## ", "\n### ", "\n#### ", "\n##### ", "\n###### ", "```\n", "\n***\n", "\n---\n",
            "\n___\n"),
    HTML(true, "<body", "<div", "<p", "<br", "<li", "<h1", "<h2", "<h3", "<h4", "<h5", "<h6",
            "<span", "<table", "<tr", "<td", "<th", "<ul", "<ol", "<header", "<footer", "<nav",
            "<head", "<style", "<script", "<meta", "<title");

    private static final Map<String, Language> BY_EXTENSION = Map.ofEntries(
            Map.entry("cpp", CPP), Map.entry("cc", CPP), Map.entry("cxx", CPP), Map.entry("c++", CPP),
            Map.entry("go", GO),
            Map.entry("java", JAVA),
            Map.entry("kt", KOTLIN), Map.entry("kts", KOTLIN),
            Map.entry("js", JS), Map.entry("mjs", JS),
            Map.entry("ts", TS),
            Map.entry("php", PHP),
            Map.entry("proto", PROTO),
            Map.entry("py", PYTHON), Map.entry("pyw", PYTHON),
            Map.entry("rb", RUBY),
            Map.entry("rs", RUST),
            Map.entry("scala", SCALA),
            Map.entry("swift", SWIFT),
            Map.entry("md", MARKDOWN), Map.entry("markdown", MARKDOWN),
            Map.entry("html", HTML), Map.entry("htm", HTML),
            Map.entry("cs", CSHARP),
            Map.entry("c", C), Map.entry("h", C),
            Map.entry("lua", LUA),
            Map.entry("pl", PERL), Map.entry("pm", PERL),
            Map.entry("hs", HASKELL),
            Map.entry("ex", ELIXIR), Map.entry("exs", ELIXIR),
            Map.entry("ps1", POWERSHELL));

    private final List<String> separators;

    Language(String... structural) {
        this(false, structural);
    }

    Language(boolean replacesGeneric, String... structural) {
        List<String> all = new ArrayList<>(List.of(structural));
        if (!replacesGeneric) {
            all.addAll(List.of("\n\n", "\n", " "));
        }
        all.add("");
        this.separators = List.copyOf(all);
    }

    public List<String> separators() {
        return separators;
    }

    /**
     * @return the language for the file's extension, or {@code null} when none applies
     */
    public static Language fromPath(String path) {
        if (path == null) {
            return null;
        }
        String name = path.substring(path.lastIndexOf('/') + 1);
        int lastDot = name.lastIndexOf('.');
        if (lastDot < 0) {
            return null;
        }
        return BY_EXTENSION.get(name.substring(lastDot + 1).toLowerCase(Locale.ROOT));
    }
}
