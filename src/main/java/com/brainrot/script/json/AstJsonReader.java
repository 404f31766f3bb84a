package com.brainrot.script.json;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.brainrot.script.core.Expr;
import com.brainrot.script.core.Expr.ExprInterface;
import com.brainrot.script.core.Modifiers;
import com.brainrot.script.core.Operator;
import com.brainrot.script.core.Statement;
import com.brainrot.script.core.Statement.Stmt;
import com.brainrot.script.core.Value;
import com.brainrot.script.core.VarType;

/**
 * Reads a program from its JSON interchange form, the document an external parser hands over.
 *
 * <pre>
 * { "program": [
 *     { "kind": "declaration", "type": "int", "name": "a", "init": { "kind": "int", "value": 5 }, "line": 1 },
 *     { "kind": "print", "value": { "kind": "binary", "op": "/",
 *         "left": { "kind": "identifier", "name": "a" }, "right": { "kind": "int", "value": 2 } } }
 * ] }
 * </pre>
 *
 * Every node is an object with a "kind" and an optional "line". Statement bodies may be a single
 * node or an array of nodes. Malformed input fails with an IllegalArgumentException naming the
 * JSON path of the offending node.
 */
public final class AstJsonReader {

    private final ObjectMapper mapper;

    public AstJsonReader() {
        this(new ObjectMapper());
    }

    public AstJsonReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public Statement.StatementList readProgram(String json) {
        try {
            return readProgram(mapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid program JSON: " + e.getOriginalMessage(), e);
        }
    }

    public Statement.StatementList readProgram(InputStream in) throws IOException {
        return readProgram(mapper.readTree(in));
    }

    public Statement.StatementList readProgram(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new IllegalArgumentException("$: empty program document");
        }
        if (root.isArray()) return statementList(root, "$");
        JsonNode program = root.get("program");
        if (program == null || !program.isArray()) {
            throw new IllegalArgumentException("$.program: expected an array of statements");
        }
        return statementList(program, "$.program");
    }

    // ===================== STATEMENTS =====================

    public Stmt readStatement(JsonNode node, String path) {
        requireObject(node, path);
        String kind = text(node, "kind", path);
        int line = node.path("line").asInt(0);

        switch (kind) {
            case "declaration":
                return new Statement.Declaration(
                        VarType.fromKeyword(text(node, "type", path)),
                        modifiers(node.get("modifiers"), path + ".modifiers"),
                        text(node, "name", path),
                        expressions(node.get("dimensions"), path + ".dimensions"),
                        optionalExpression(node, "init", path),
                        node.has("elements") ? expressions(node.get("elements"), path + ".elements") : null,
                        line);
            case "assignment":
                return new Statement.Assignment(
                        expression(node, "target", path),
                        expression(node, "value", path),
                        line);
            case "if":
                return new Statement.If(
                        expression(node, "condition", path),
                        body(node, "then", path, true),
                        body(node, "else", path, false),
                        line);
            case "for":
                return new Statement.For(
                        body(node, "init", path, false),
                        optionalExpression(node, "condition", path),
                        body(node, "increment", path, false),
                        body(node, "body", path, true),
                        line);
            case "while":
                return new Statement.While(
                        expression(node, "condition", path),
                        body(node, "body", path, true),
                        line);
            case "do_while":
                return new Statement.DoWhile(
                        body(node, "body", path, true),
                        expression(node, "condition", path),
                        line);
            case "switch":
                return new Statement.Switch(
                        expression(node, "expression", path),
                        cases(node.get("cases"), path + ".cases"),
                        line);
            case "break":
                return new Statement.Break(line);
            case "return":
                return new Statement.Return(optionalExpression(node, "value", path), line);
            case "function":
                return new Statement.FunctionDef(
                        text(node, "name", path),
                        VarType.fromKeyword(node.path("returnType").asText("void")),
                        params(node.get("params"), path + ".params"),
                        body(node, "body", path, true),
                        line);
            case "block":
                return new Statement.StatementList(
                        statementList(node.get("statements"), path + ".statements").statements, line);
            case "print":
                return new Statement.Print(expression(node, "value", path), line);
            case "error_print":
                return new Statement.ErrorPrint(expression(node, "value", path), line);
            case "expression":
                return new Statement.ExprStmt(expression(node, "expression", path), line);
            default:
                throw new IllegalArgumentException(path + ": unknown statement kind '" + kind + "'");
        }
    }

    private Statement.StatementList statementList(JsonNode array, String path) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException(path + ": expected an array of statements");
        }
        List<Stmt> out = new ArrayList<>(array.size());
        for (int i = 0; i < array.size(); i++) {
            out.add(readStatement(array.get(i), path + "[" + i + "]"));
        }
        return new Statement.StatementList(out, 0);
    }

    private Stmt body(JsonNode parent, String field, String path, boolean required) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            if (required) throw new IllegalArgumentException(path + "." + field + ": missing");
            return null;
        }
        if (node.isArray()) return statementList(node, path + "." + field);
        return readStatement(node, path + "." + field);
    }

    private List<Statement.Case> cases(JsonNode array, String path) {
        if (array == null || !array.isArray()) {
            throw new IllegalArgumentException(path + ": expected an array of cases");
        }
        List<Statement.Case> out = new ArrayList<>();
        for (int i = 0; i < array.size(); i++) {
            String at = path + "[" + i + "]";
            JsonNode c = array.get(i);
            requireObject(c, at);
            ExprInterface value = optionalExpression(c, "value", at);
            JsonNode body = c.get("body");
            List<Stmt> stmts = (body == null || body.isNull()) ? List.of() : statementList(body, at + ".body").statements;
            out.add(new Statement.Case(value, stmts));
        }
        return out;
    }

    private List<Statement.Param> params(JsonNode array, String path) {
        List<Statement.Param> out = new ArrayList<>();
        if (array == null || array.isNull()) return out;
        if (!array.isArray()) throw new IllegalArgumentException(path + ": expected an array of parameters");
        for (int i = 0; i < array.size(); i++) {
            String at = path + "[" + i + "]";
            JsonNode p = array.get(i);
            requireObject(p, at);
            out.add(new Statement.Param(
                    text(p, "name", at),
                    VarType.fromKeyword(text(p, "type", at)),
                    modifiers(p.get("modifiers"), at + ".modifiers")));
        }
        return out;
    }

    private static Modifiers modifiers(JsonNode array, String path) {
        if (array == null || array.isNull()) return Modifiers.NONE;
        if (!array.isArray()) throw new IllegalArgumentException(path + ": expected an array of modifiers");
        boolean isConst = false;
        boolean isUnsigned = false;
        boolean isVolatile = false;
        for (JsonNode m : array) {
            switch (m.asText()) {
                case "const": isConst = true; break;
                case "unsigned": isUnsigned = true; break;
                case "volatile": isVolatile = true; break;
                default: throw new IllegalArgumentException(path + ": unknown modifier '" + m.asText() + "'");
            }
        }
        return new Modifiers(isConst, isUnsigned, isVolatile);
    }

    // ===================== EXPRESSIONS =====================

    public ExprInterface readExpression(JsonNode node, String path) {
        requireObject(node, path);
        String kind = text(node, "kind", path);
        int line = node.path("line").asInt(0);

        switch (kind) {
            case "int":
                return new Expr.Literal(Value.int32(number(node, path).intValue()), line);
            case "short":
                return new Expr.Literal(Value.int16(number(node, path).shortValue()), line);
            case "float":
                return new Expr.Literal(Value.float32(number(node, path).floatValue()), line);
            case "double":
                return new Expr.Literal(Value.float64(number(node, path).doubleValue()), line);
            case "char":
                return new Expr.Literal(Value.character(charCode(node, path)), line);
            case "bool": {
                JsonNode v = node.get("value");
                if (v == null || !v.isBoolean()) throw new IllegalArgumentException(path + ".value: expected a boolean");
                return new Expr.Literal(Value.bool(v.booleanValue()), line);
            }
            case "string": {
                JsonNode v = node.get("value");
                if (v == null || !v.isTextual()) throw new IllegalArgumentException(path + ".value: expected a string");
                return new Expr.Literal(Value.string(v.textValue()), line);
            }
            case "identifier":
                return new Expr.Identifier(text(node, "name", path), line);
            case "binary":
                return new Expr.Binary(
                        operator(node, path, false),
                        expression(node, "left", path),
                        expression(node, "right", path),
                        node.path("unsigned").asBoolean(false),
                        line);
            case "unary":
                return new Expr.Unary(operator(node, path, true), expression(node, "operand", path), line);
            case "index":
                return new Expr.ArrayAccess(text(node, "name", path),
                        expressions(node.get("indices"), path + ".indices"), line);
            case "call":
                return new Expr.Call(text(node, "name", path),
                        expressions(node.get("args"), path + ".args"), line);
            case "sizeof":
                return new Expr.Sizeof(expression(node, "operand", path), line);
            default:
                throw new IllegalArgumentException(path + ": unknown expression kind '" + kind + "'");
        }
    }

    private ExprInterface expression(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) throw new IllegalArgumentException(path + "." + field + ": missing");
        return readExpression(node, path + "." + field);
    }

    private ExprInterface optionalExpression(JsonNode parent, String field, String path) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) return null;
        return readExpression(node, path + "." + field);
    }

    private List<ExprInterface> expressions(JsonNode array, String path) {
        List<ExprInterface> out = new ArrayList<>();
        if (array == null || array.isNull()) return out;
        if (!array.isArray()) throw new IllegalArgumentException(path + ": expected an array of expressions");
        for (int i = 0; i < array.size(); i++) {
            out.add(readExpression(array.get(i), path + "[" + i + "]"));
        }
        return out;
    }

    private static Operator operator(JsonNode node, String path, boolean unary) {
        String symbol = text(node, "op", path);
        try {
            return unary ? Operator.unary(symbol) : Operator.binary(symbol);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ".op: " + e.getMessage(), e);
        }
    }

    private static Number number(JsonNode node, String path) {
        JsonNode v = node.get("value");
        if (v == null || !v.isNumber()) throw new IllegalArgumentException(path + ".value: expected a number");
        return v.numberValue();
    }

    private static int charCode(JsonNode node, String path) {
        JsonNode v = node.get("value");
        if (v != null && v.isTextual() && v.textValue().length() == 1) return v.textValue().charAt(0);
        if (v != null && v.isIntegralNumber()) return v.intValue();
        throw new IllegalArgumentException(path + ".value: expected a one-character string or a char code");
    }

    // ===================== HELPERS =====================

    private static void requireObject(JsonNode node, String path) {
        if (node == null || !node.isObject()) throw new IllegalArgumentException(path + ": expected an object");
    }

    private static String text(JsonNode node, String field, String path) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException(path + "." + field + ": expected a string");
        }
        return v.textValue();
    }
}
