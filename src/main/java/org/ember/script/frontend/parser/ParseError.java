package org.ember.script.frontend.parser;

/**
 * Unwinds the parser to the nearest statement boundary after a syntax error
 * has been reported. Never escapes {@link Parser#parse()}.
 */
class ParseError extends RuntimeException {

    ParseError() {
        super(null, null, false, false);
    }
}
