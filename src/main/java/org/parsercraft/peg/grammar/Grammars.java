package org.parsercraft.peg.grammar;

/**
 * Built-in grammar presets.
 */
public final class Grammars {
    private static final String DEFAULT_GRAMMAR_TEXT = """
        program     <- statement*
        statement   <- function_def / if_stmt / while_stmt / for_stmt / return_stmt / assignment / expr_stmt
        function_def <- 'def' IDENT '(' param_list? ')' ':' block
        param_list  <- IDENT (',' IDENT)*
        if_stmt     <- 'if' expr ':' block ('elif' expr ':' block)* ('else' ':' block)?
        while_stmt  <- 'while' expr ':' block
        for_stmt    <- 'for' IDENT 'in' expr ':' block
        return_stmt <- 'return' expr?
        assignment  <- IDENT '=' expr
        expr_stmt   <- expr
        block       <- statement+
        expr        <- comparison
        comparison  <- addition (('==' / '!=' / '<=' / '>=' / '<' / '>') addition)*
        addition    <- multiplication (('+' / '-') multiplication)*
        multiplication <- unary (('*' / '/' / '%') unary)*
        unary       <- ('-' / '!') unary / call
        call        <- primary ('(' arg_list? ')')*
        arg_list    <- expr (',' expr)*
        primary     <- NUMBER / STRING / IDENT / '(' expr ')' / list_literal
        list_literal <- '[' (expr (',' expr)*)? ']'
        """;

    private static volatile Grammar defaultGrammar;

    private Grammars() {}

    /**
     * Expression-oriented grammar for Python-like languages, used when a language
     * configuration declares no rules.
     */
    public static Grammar defaultGrammar() {
        var grammar = defaultGrammar;
        if (grammar == null) {
            grammar = GrammarParser.parse(DEFAULT_GRAMMAR_TEXT, "default");
            defaultGrammar = grammar;
        }
        return grammar;
    }

    public static String defaultGrammarText() {
        return DEFAULT_GRAMMAR_TEXT;
    }
}
