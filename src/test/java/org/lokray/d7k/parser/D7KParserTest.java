package org.lokray.d7k.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.d7k.ast.Program;
import org.lokray.d7k.ast.expressions.BinaryExpression;
import org.lokray.d7k.ast.expressions.ErrorExpression;
import org.lokray.d7k.ast.statements.BlockStatement;
import org.lokray.d7k.ast.statements.IfStatement;
import org.lokray.d7k.ast.statements.Statement;
import org.lokray.d7k.lexer.Scanner;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.util.Diagnostic;
import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.Phase;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class D7KParserTest
{
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
	}

	private Program parse(String source)
	{
		return new D7KParser(new Scanner(source, reporter).scanTokens(), reporter).parse();
	}

	/**
	 * Parses {@code body} inside a main function and returns the rendered main block.
	 */
	private String parseBody(String body)
	{
		return parse("d7kbdaya() {" + body + "}").getMainFunction().getBody().toString();
	}

	private List<String> messages()
	{
		return reporter.getDiagnostics().stream().map(Diagnostic::getMessage).collect(Collectors.toList());
	}

	@Test
	void parsesDeclarationAndOutput()
	{
		Program program = parse("d7kbdaya() { d7krqm x = 5; d7ktba3a(x); }");

		assertEquals("Program(MainFunction(Block[VarDecl(NUMBER,x,Literal(5)), OutputStmt(VarRef(x))]))", program.toString());
		assertFalse(reporter.hasErrors());
	}

	@Test
	void declarationWithoutInitializer()
	{
		assertEquals("Block[VarDecl(STRING,s), VarDecl(BOOL,b,Literal(true)), VarDecl(DECIMAL,d,Literal(0.5))]",
				parseBody("d7kmslsl s; d7kmntq b = true; d7k34ry d = 0.5;"));
		assertFalse(reporter.hasErrors());
	}

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		assertEquals("Block[VarDecl(NUMBER,x,(Literal(1) + (Literal(2) * Literal(3))))]",
				parseBody("d7krqm x = 1 + 2 * 3;"));
	}

	@Test
	void operatorsAreLeftAssociative()
	{
		assertEquals("Block[Assign(x,((Literal(10) - Literal(4)) - Literal(3)))]", parseBody("x = 10 - 4 - 3;"));
		assertEquals("Block[Assign(x,((Literal(8) / Literal(4)) / Literal(2)))]", parseBody("x = 8 / 4 / 2;"));
	}

	@Test
	void comparisonBindsTighterThanEquality()
	{
		assertEquals("Block[VarDecl(BOOL,b,((Literal(1) < (Literal(2) + Literal(3))) == Literal(true)))]",
				parseBody("d7kmntq b = 1 < 2 + 3 == true;"));
	}

	@Test
	void parenthesesOverridePrecedence()
	{
		assertEquals("Block[Assign(x,((Literal(1) + Literal(2)) * Literal(3)))]", parseBody("x = (1 + 2) * 3;"));
	}

	@Test
	void parsesIfWithElse()
	{
		assertEquals("Block[If((VarRef(x) > Literal(0)),Block[OutputStmt(Literal(\"pos\"))],Block[OutputStmt(Literal(\"neg\"))])]",
				parseBody("d7klo (x > 0) { d7ktba3a(\"pos\"); } d7k8er { d7ktba3a(\"neg\"); }"));
	}

	@Test
	void parsesWhileLoop()
	{
		assertEquals("Block[While((VarRef(i) != Literal(0)),Block[Assign(i,(VarRef(i) - Literal(1)))])]",
				parseBody("d7kdw5ny (i != 0) { i = i - 1; }"));
	}

	@Test
	void parsesForLoopWithAssignmentClauses()
	{
		assertEquals("Block[For(Assign(i,Literal(0)),(VarRef(i) < Literal(10)),Assign(i,(VarRef(i) + Literal(1))),Block[InputStmt(i)])]",
				parseBody("d7klf (i = 0; i < 10; i = i + 1) { d7ked5al(i); }"));
	}

	@Test
	void returnValueIsOptional()
	{
		assertEquals("Block[ReturnStmt(), ReturnStmt(Literal(0))]", parseBody("d7krg3; d7krg3 0;"));
	}

	@Test
	void nodesKnowTheirLines()
	{
		Program program = parse("d7kbdaya()\n{\n  d7krqm x = 1;\n\n  d7ktba3a(x);\n}");

		List<Statement> statements = program.getMainFunction().getBody().getStatements();
		assertEquals(1, program.getLine());
		assertEquals(2, program.getMainFunction().getBody().getLine());
		assertEquals(3, statements.get(0).getLine());
		assertEquals(5, statements.get(1).getLine());
	}

	@Test
	void missingOperandBecomesErrorExpression()
	{
		Program program = parse("d7kbdaya() { d7klo (1 > ) { } }");

		assertEquals(List.of("Expected expression but found ')'."), messages());
		assertEquals(Phase.SYNTAX, reporter.getDiagnostics().get(0).getPhase());

		IfStatement ifStatement = (IfStatement) program.getMainFunction().getBody().getStatements().get(0);
		BinaryExpression condition = (BinaryExpression) ifStatement.getCondition();
		assertInstanceOf(ErrorExpression.class, condition.getRight());
		assertEquals("If((Literal(1) > <error>),Block[])", ifStatement.toString());
	}

	@Test
	void recoversAtStatementBoundaries()
	{
		String source = "d7kbdaya() {\n"
				+ "  d7krqm = 5;\n"
				+ "  d7ktba3a(1);\n"
				+ "  x 3;\n"
				+ "  d7ktba3a(2);\n"
				+ "}";

		Program program = parse(source);

		assertEquals(List.of("Expected identifier but found '='.", "Expected '=' but found '3'."), messages());
		assertEquals(2, reporter.getDiagnostics().get(0).getLine());
		assertEquals(4, reporter.getDiagnostics().get(1).getLine());
		assertEquals("Block[OutputStmt(Literal(1)), OutputStmt(Literal(2))]", program.getMainFunction().getBody().toString());
	}

	@Test
	void missingSemicolonResumesAtNextStatementKeyword()
	{
		String body = parseBody("d7ktba3a(1) d7ktba3a(2);");

		assertEquals(List.of("Expected ';' but found 'd7ktba3a'."), messages());
		assertEquals("Block[OutputStmt(Literal(2))]", body);
	}

	@Test
	void strayTokenIsSkipped()
	{
		String body = parseBody(") d7ktba3a(1);");

		assertEquals(List.of("Expected statement but found ')'."), messages());
		assertEquals("Block[OutputStmt(Literal(1))]", body);
	}

	@Test
	void elseWithoutIfIsNotAStatement()
	{
		parseBody("d7k8er { }");

		assertEquals("Expected statement but found 'd7k8er'.", messages().get(0));
	}

	@Test
	void missingClosingBraceKeepsPartialBlock()
	{
		Program program = parse("d7kbdaya() { d7ktba3a(1);");

		assertEquals(List.of("Expected '}' but found end of input."), messages());
		assertEquals("Block[OutputStmt(Literal(1))]", program.getMainFunction().getBody().toString());
	}

	@Test
	void malformedMainHeaderStillParsesBody()
	{
		Program program = parse("d7kbdaya( { d7ktba3a(1); }");

		assertEquals(List.of("Expected ')' but found '{'."), messages());
		assertEquals("Block[OutputStmt(Literal(1))]", program.getMainFunction().getBody().toString());
	}

	@Test
	void missingMainKeywordIsReported()
	{
		Program program = parse("{ d7ktba3a(1); }");

		assertEquals(List.of("Expected 'd7kbdaya' but found '{'."), messages());
		assertEquals(1, program.getMainFunction().getBody().getStatements().size());
	}

	@Test
	void tokensAfterMainAreReportedOnce()
	{
		parse("d7kbdaya() { } d7ktba3a(1); d7ktba3a(2);");

		assertEquals(List.of("Expected end of input but found 'd7ktba3a'."), messages());
	}

	@Test
	void emptyInputStillBuildsMainFunction()
	{
		Program program = parse("");

		assertEquals(List.of("Expected 'd7kbdaya' but found end of input."), messages());
		assertNotNull(program.getMainFunction());
		assertTrue(program.getMainFunction().getBody().getStatements().isEmpty());
	}

	@Test
	void garbageNeverThrows()
	{
		Program program = assertDoesNotThrow(() -> parse("}}}((( d7klo d7k8er ;; = == d7kbdaya"));

		assertNotNull(program.getMainFunction());
		assertTrue(reporter.hasErrors(Phase.SYNTAX));
	}

	@Test
	void unclosedNestedBlocksAreEachReported()
	{
		Program program = parse("d7kbdaya() { d7kdw5ny (true) { d7ktba3a(1);");

		assertEquals(List.of("Expected '}' but found end of input.", "Expected '}' but found end of input."), messages());
		BlockStatement body = program.getMainFunction().getBody();
		assertEquals("Block[While(Literal(true),Block[OutputStmt(Literal(1))])]", body.toString());
	}

	@Test
	void validProgramHasNoDiagnostics()
	{
		String source = "d7kbdaya() {\n"
				+ "  d7krqm n;\n"
				+ "  d7ked5al(n);\n"
				+ "  d7krqm i = 0;\n"
				+ "  d7krqm total = 0;\n"
				+ "  d7klf (i = 1; i <= n; i = i + 1) {\n"
				+ "    total = total + i * i;\n"
				+ "  }\n"
				+ "  d7klo (total >= 100) { d7ktba3a(\"big\"); } d7k8er { d7ktba3a(total); }\n"
				+ "  d7krg3 0;\n"
				+ "}\n";

		Program program = parse(source);

		assertFalse(reporter.hasErrors(), () -> reporter.getDiagnostics().toString());
		assertEquals(7, program.getMainFunction().getBody().getStatements().size());
	}

	@Test
	void returnBeforeClosingBraceReportsOnlyTheMissingSemicolon()
	{
		String body = parseBody("d7krg3 ");

		assertEquals(List.of("Expected ';' but found '}'."), messages());
		assertEquals("Block[]", body);
	}

	@Test
	void unclosedConditionDoesNotCloseTheEnclosingBlock()
	{
		String body = parseBody("d7klo (x { d7ktba3a(1); } d7kmslsl s = 5;");

		assertEquals(List.of("Expected ')' but found '{'."), messages());
		assertEquals("Block[VarDecl(STRING,s,Literal(5))]", body);
	}

	@Test
	void strayBlockIsSkippedWhole()
	{
		String body = parseBody("{ d7ktba3a(1); } d7ktba3a(2);");

		assertEquals(List.of("Expected statement but found '{'."), messages());
		assertEquals("Block[OutputStmt(Literal(2))]", body);
	}

	@Test
	void appendedEofUsesOneBasedColumns()
	{
		new D7KParser(new ArrayList<>(), reporter).parse();

		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals("Expected 'd7kbdaya' but found end of input.", diagnostic.getMessage());
		assertEquals(1, diagnostic.getLine());
		assertEquals(1, diagnostic.getColumn());
	}

	@Test
	void missingEofIsAddedAtLastTokenPosition()
	{
		List<Token> tokens = new Scanner("d7kbdaya() {", reporter).scanTokens();

		new D7KParser(tokens.subList(0, tokens.size() - 1), reporter).parse();

		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals("Expected '}' but found end of input.", diagnostic.getMessage());
		assertEquals(12, diagnostic.getColumn());
	}

	@Test
	void deeplyNestedParenthesesAreReportedOnce()
	{
		String body = assertDoesNotThrow(() -> parseBody("d7krqm x = " + "(".repeat(20000) + "1" + ")".repeat(20000) + ";"));

		assertEquals(List.of("Nesting too deep: more than 256 levels."), messages());
		assertEquals("Block[VarDecl(NUMBER,x,<error>)]", body);
	}

	@Test
	void deeplyNestedBlocksAreReportedOnce()
	{
		String source = "d7kbdaya() {" + "d7klo (true) {".repeat(20000) + "}".repeat(20000) + " d7ktba3a(1); }";

		Program program = assertDoesNotThrow(() -> parse(source));

		assertEquals(List.of("Nesting too deep: more than 256 levels."), messages());
		List<Statement> statements = program.getMainFunction().getBody().getStatements();
		assertEquals(2, statements.size());
		assertEquals("OutputStmt(Literal(1))", statements.get(1).toString());
	}

	@Test
	void longOperatorChainDropsOnlyItsStatement()
	{
		String body = assertDoesNotThrow(() -> parseBody("d7krqm x = 1" + " + 1".repeat(20000) + "; d7ktba3a(2);"));

		assertEquals(List.of("Nesting too deep: more than 256 levels."), messages());
		assertEquals("Block[OutputStmt(Literal(2))]", body);
	}

	@Test
	void nestingLimitIsConfigurable()
	{
		String source = "d7kbdaya() { d7krqm a = ((1)); d7krqm b = (((1))); d7klo (true) { d7klo (true) { d7klo (true) { } } } }";

		Program program = new D7KParser(new Scanner(source, reporter).scanTokens(), reporter, 3).parse();

		assertEquals(List.of("Nesting too deep: more than 3 levels.", "Nesting too deep: more than 3 levels."), messages());
		assertEquals("Block[VarDecl(NUMBER,a,Literal(1)), VarDecl(NUMBER,b,<error>), If(Literal(true),Block[If(Literal(true),Block[If(Literal(true),Block[])])])]",
				program.getMainFunction().getBody().toString());
	}

	@Test
	void nestingLimitMustBePositive()
	{
		assertThrows(IllegalArgumentException.class, () -> new D7KParser(new ArrayList<>(), reporter, 0));
	}
}
