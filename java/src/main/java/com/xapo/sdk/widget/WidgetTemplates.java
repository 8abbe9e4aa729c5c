package com.xapo.sdk.widget;

/** Fixed HTML snippets the widget URL is substituted into. */
final class WidgetTemplates {

    private static final String IFRAME =
            "\n"
            + "<iframe id=\"tipButtonFrame\" scrolling=\"no\" frameborder=\"0\"\n"
            + "    style=\"border:none; overflow:hidden; height:22px;\"\n"
            + "    allowTransparency=\"true\" src=\"%s\">\n"
            + "</iframe>\n";

    private static final String DIV =
            "\n"
            + "<div id=\"tipButtonDiv\" class=\"tipButtonDiv\"></div>\n"
            + "<div id=\"tipButtonPopup\" class=\"tipButtonPopup\"></div>\n"
            + "<script>\n"
            + "    $(document).ready(function() {\n"
            + "        $(\"#tipButtonDiv\").load(\"%s\");\n"
            + "    });\n"
            + "</script>\n";

    private WidgetTemplates() {}

    static String iframe(String url) {
        return String.format(IFRAME, url);
    }

    static String div(String url) {
        return String.format(DIV, url);
    }
}
