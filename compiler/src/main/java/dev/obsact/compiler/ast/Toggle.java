package dev.obsact.compiler.ast;

public enum Toggle {
    ON("turnOn"),
    OFF("turnOff");

    private final String keyword;

    Toggle(String keyword) {
        this.keyword = keyword;
    }

    /** The source keyword, which is also the name of the runtime function it calls. */
    public String keyword() {
        return keyword;
    }
}
