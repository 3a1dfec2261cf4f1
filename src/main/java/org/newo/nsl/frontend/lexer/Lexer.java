package org.newo.nsl.frontend.lexer;

import java.util.ArrayList;
import java.util.List;

/**
 * The Lexer (also known as Tokenizer or Scanner) converts the text of one NSL template
 * into a sequence of tokens.
 * <p>
 * Tokens are produced lazily by {@link #nextToken()}; once the input is exhausted every further
 * call returns an {@link TokenType#EOF} token. Lexing never fails: characters that cannot start a
 * token become {@link TokenType#ILLEGAL} tokens and are left to the parser to report.
 * A lexer instance is single-use and not thread-safe.
 */
public class Lexer {

    private final String source;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The template source as a single string.
     */
    public Lexer(String source) {
        this.source = source;
    }

    /**
     * Performs the tokenization of the entire remaining source.
     * @return A list of the recognized tokens, terminated by an {@link TokenType#EOF} token.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    /**
     * Scans the next token.
     * @return The next token, or an {@link TokenType#EOF} token at the end of the input.
     */
    public Token nextToken() {
        skipWhitespaceAndComments();
        start = current;
        startLine = line;
        startColumn = column;
        if (isAtEnd()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char c = advance();
        switch (c) {
            case '{':
                if (match('{')) return makeToken(TokenType.LBRACE);
                if (match('%')) return makeToken(TokenType.LPERCENT);
                return makeToken(TokenType.ILLEGAL);
            case '}':
                return makeToken(match('}') ? TokenType.RBRACE : TokenType.ILLEGAL);
            case '%':
                return makeToken(match('}') ? TokenType.RPERCENT : TokenType.ILLEGAL);
            case '=':
                return makeToken(match('=') ? TokenType.EQ : TokenType.ASSIGN);
            case '!':
                return makeToken(match('=') ? TokenType.NOT_EQ : TokenType.BANG);
            case '<':
                return makeToken(match('=') ? TokenType.LTE : TokenType.LT);
            case '>':
                return makeToken(match('=') ? TokenType.GTE : TokenType.GT);
            case '+': return makeToken(TokenType.PLUS);
            case '-': return makeToken(TokenType.MINUS);
            case '*': return makeToken(TokenType.ASTERISK);
            case '/': return makeToken(TokenType.SLASH);
            case '.': return makeToken(TokenType.DOT);
            case '|': return makeToken(TokenType.PIPE);
            case '"', '\'':
                return string(c);
            default:
                if (isDigit(c)) {
                    return number();
                }
                if (isAlpha(c)) {
                    return identifier();
                }
                // Keep a surrogate pair together so one character yields one token.
                if (Character.isHighSurrogate(c) && Character.isLowSurrogate(peek())) {
                    advance();
                }
                return makeToken(TokenType.ILLEGAL);
        }
    }

    private void skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (c == '{' && peekNext() == '#') {
                // {# ... #} comments are dropped here; the linter reports them separately.
                advance();
                advance();
                while (!isAtEnd() && !(peek() == '#' && peekNext() == '}')) {
                    advance();
                }
                if (!isAtEnd()) {
                    advance();
                    advance();
                }
            } else {
                return;
            }
        }
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        return new Token(TokenType.lookupIdent(text), text, startLine, startColumn);
    }

    private Token number() {
        while (isDigit(peek())) advance();
        return makeToken(TokenType.INT);
    }

    private Token string(char quote) {
        while (!isAtEnd() && peek() != quote) {
            advance();
        }

        if (isAtEnd()) {
            // Unterminated: hand the raw remainder to the parser as an illegal token.
            return makeToken(TokenType.ILLEGAL);
        }

        // The closing quote
        advance();

        String value = source.substring(start + 1, current - 1);
        return new Token(TokenType.STRING, value, startLine, startColumn);
    }

    private Token makeToken(TokenType type) {
        return new Token(type, source.substring(start, current), startLine, startColumn);
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) {
            return false;
        }
        advance();
        return true;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
