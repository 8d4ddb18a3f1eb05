package co.fanki.cdnmirror.fetch.domain;

/**
 * One module specifier found in a source file.
 *
 * <p>The offsets delimit the specifier text inside its quotes, so the
 * rewriter can replace it in place without touching anything else.</p>
 *
 * @param value the specifier exactly as written
 * @param kind the syntax it was found in
 * @param start offset of the first character of the specifier
 * @param end offset just past the last character of the specifier
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ImportSpecifier(String value, Kind kind, int start, int end) {

    /** The syntactic form of an import. */
    public enum Kind {

        /** {@code import x from "m"}, {@code import {a} from "m"}. */
        STATIC,

        /** {@code import("m")} with a string literal argument. */
        DYNAMIC,

        /** {@code import "m"}. */
        BARE,

        /** {@code export * from "m"}, {@code export {a} from "m"}. */
        RE_EXPORT
    }

    /** @return true for root-relative specifiers such as {@code /react@18} */
    public boolean isRootRelative() {
        return value.startsWith("/") && !value.startsWith("//");
    }

    /** @return true for {@code ./} and {@code ../} specifiers */
    public boolean isRelative() {
        return value.startsWith("./") || value.startsWith("../");
    }

    /** @return true for {@code http://} and {@code https://} specifiers */
    public boolean isAbsoluteUrl() {
        return value.startsWith("https://") || value.startsWith("http://");
    }

}
