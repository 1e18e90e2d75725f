package org.lokray.d7k.semantics;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.lokray.d7k.ast.Program;
import org.lokray.d7k.ast.expressions.BinaryExpression;
import org.lokray.d7k.ast.expressions.IdentifierExpression;
import org.lokray.d7k.ast.statements.IfStatement;
import org.lokray.d7k.ast.statements.OutputStatement;
import org.lokray.d7k.ast.statements.ReturnStatement;
import org.lokray.d7k.ast.statements.Statement;
import org.lokray.d7k.ast.statements.VariableDeclarationStatement;
import org.lokray.d7k.lexer.Scanner;
import org.lokray.d7k.lexer.Token;
import org.lokray.d7k.parser.D7KParser;
import org.lokray.d7k.util.Diagnostic;
import org.lokray.d7k.util.ErrorReporter;
import org.lokray.d7k.util.Phase;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest
{
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
	}

	/**
	 * Parses and analyzes {@code body} wrapped in a main function. The body must be syntactically valid.
	 */
	private Program analyzeBody(String body)
	{
		String source = "d7kbdaya() {" + body + "}";
		Program program = new D7KParser(new Scanner(source, reporter).scanTokens(), reporter).parse();
		assertFalse(reporter.hasErrors(), () -> "unexpected syntax errors: " + reporter.getDiagnostics());
		new SemanticAnalyzer(reporter).analyze(program);
		return program;
	}

	private List<String> messages()
	{
		return reporter.getDiagnostics().stream().map(Diagnostic::getMessage).collect(Collectors.toList());
	}

	private static List<Statement> statements(Program program)
	{
		return program.getMainFunction().getBody().getStatements();
	}

	@Test
	void wellTypedProgramHasNoDiagnostics()
	{
		analyzeBody("d7krqm n; d7ked5al(n); d7krqm total = 0; d7krqm i = 0;"
				+ "d7klf (i = 0; i < n; i = i + 1) { total = total + i; }"
				+ "d7kmslsl label = \"total: \";"
				+ "d7klo (total == 0) { d7ktba3a(label + \"none\"); } d7k8er { d7ktba3a(total); }"
				+ "d7kmntq done = false; d7kdw5ny (done != true) { done = true; }"
				+ "d7krg3 0;");

		assertEquals(List.of(), messages());
	}

	@Test
	void initializerOfWrongTypeIsMismatch()
	{
		analyzeBody("d7kmslsl s = 5;");

		assertEquals(List.of("type mismatch: expected STRING, found NUMBER"), messages());
		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals(Phase.SEMANTIC, diagnostic.getPhase());
		assertEquals(1, diagnostic.getLine());
	}

	@Test
	void assignmentToUndeclaredName()
	{
		analyzeBody("x = 1;");

		assertEquals(List.of("undeclared identifier: x"), messages());
	}

	@Test
	void duplicateDeclarationInSameScope()
	{
		analyzeBody("d7krqm x = 1;\nd7krqm x = 2;");

		assertEquals(List.of("duplicate declaration: x"), messages());
		assertEquals(2, reporter.getDiagnostics().get(0).getLine());
	}

	@Test
	void innerBlockMayShadowOuterName()
	{
		Program program = analyzeBody("d7krqm x = 1; d7klo (true) { d7kmslsl x = \"s\"; d7ktba3a(x + \"t\"); } d7ktba3a(x + 1);");

		assertEquals(List.of(), messages());

		IfStatement ifStatement = (IfStatement) statements(program).get(1);
		OutputStatement innerOutput = (OutputStatement) ifStatement.getThenBranch().getStatements().get(1);
		IdentifierExpression innerRef = (IdentifierExpression) ((BinaryExpression) innerOutput.getExpression()).getLeft();
		assertEquals(PrimitiveType.STRING, innerRef.getResolvedSymbol().getType());
		assertEquals(2, innerRef.getResolvedSymbol().getScopeDepth());

		OutputStatement outerOutput = (OutputStatement) statements(program).get(2);
		IdentifierExpression outerRef = (IdentifierExpression) ((BinaryExpression) outerOutput.getExpression()).getLeft();
		assertEquals(PrimitiveType.NUMBER, outerRef.getResolvedType());
		assertEquals(1, outerRef.getResolvedSymbol().getScopeDepth());
	}

	@Test
	void symbolsDieWithTheirBlock()
	{
		analyzeBody("d7klo (true) { d7krqm y = 1; } y = 2;");

		assertEquals(List.of("undeclared identifier: y"), messages());
	}

	@Test
	void siblingBlocksMayReuseNames()
	{
		analyzeBody("d7klo (true) { d7krqm y = 1; } d7k8er { d7kmntq y = false; }");

		assertEquals(List.of(), messages());
	}

	@Test
	void initializerCannotSeeTheNameItDeclares()
	{
		analyzeBody("d7krqm x = x;");

		assertEquals(List.of("undeclared identifier: x"), messages());
	}

	@Test
	void declarationRecordsItsSymbol()
	{
		Program program = analyzeBody("d7k34ry d = 1.5;");

		VariableDeclarationStatement declaration = (VariableDeclarationStatement) statements(program).get(0);
		assertEquals("d", declaration.getSymbol().getName());
		assertEquals(PrimitiveType.DECIMAL, declaration.getSymbol().getType());
		assertEquals(PrimitiveType.DECIMAL, declaration.getInitializer().getResolvedType());
	}

	@Test
	void numberAndDecimalWidenIntoEachOther()
	{
		Program program = analyzeBody("d7k34ry d = 1; d7krqm n = 2.5; d7ktba3a(d * n); d7ktba3a(n + 1); d7kmntq b = n == d;");

		assertEquals(List.of(), messages());
		OutputStatement mixed = (OutputStatement) statements(program).get(2);
		OutputStatement integral = (OutputStatement) statements(program).get(3);
		assertEquals(PrimitiveType.DECIMAL, mixed.getExpression().getResolvedType());
		assertEquals(PrimitiveType.NUMBER, integral.getExpression().getResolvedType());
	}

	@Test
	void stringsConcatenateWithPlusOnly()
	{
		analyzeBody("d7kmslsl a = \"x\" + \"y\"; d7kmslsl b = \"x\" - \"y\";");

		assertEquals(List.of("type mismatch: expected NUMBER, found STRING"), messages());
	}

	@Test
	void stringPlusNumberIsMismatch()
	{
		analyzeBody("d7kmslsl s = \"a\" + 1;");

		assertEquals(List.of("type mismatch: expected STRING, found NUMBER"), messages());
	}

	@Test
	void booleansAreNotArithmetic()
	{
		analyzeBody("d7kmntq b = true + false;");

		assertEquals(List.of("type mismatch: expected NUMBER, found BOOL"), messages());
	}

	@Test
	void equalityRequiresCompatibleOperands()
	{
		analyzeBody("d7kmntq a = true == false; d7kmntq b = \"s\" != \"t\"; d7kmntq c = true == 1;");

		assertEquals(List.of("type mismatch: expected BOOL, found NUMBER"), messages());
	}

	@Test
	void relationalOperatorsRequireNumbers()
	{
		analyzeBody("d7kmntq b = \"a\" < \"b\";");

		assertEquals(List.of("type mismatch: expected NUMBER, found STRING"), messages());
	}

	@Test
	void conditionsMustBeBoolean()
	{
		analyzeBody("d7krqm i; d7klo (1) { } d7kdw5ny (\"s\") { } d7klf (i = 0; i; i = i + 1) { }");

		assertEquals(List.of(
				"type mismatch: expected BOOL, found NUMBER",
				"type mismatch: expected BOOL, found STRING",
				"type mismatch: expected BOOL, found NUMBER"), messages());
	}

	@Test
	void assignmentMustMatchDeclaredType()
	{
		analyzeBody("d7kmntq b; b = 3;");

		assertEquals(List.of("type mismatch: expected BOOL, found NUMBER"), messages());
	}

	@Test
	void inputTargetMustBeDeclared()
	{
		analyzeBody("d7ked5al(z);");

		assertEquals(List.of("undeclared identifier: z"), messages());
	}

	@Test
	void erroneousOperandsDoNotCascade()
	{
		analyzeBody("d7krqm x = y + 1 * 2; d7klo (y > 0) { }");

		assertEquals(List.of("undeclared identifier: y", "undeclared identifier: y"), messages());
	}

	@Test
	void analysisContinuesPastErrors()
	{
		analyzeBody("a = 1;\nd7kmslsl s = true;\nd7krqm s = 2;\nd7ked5al(q);");

		List<Diagnostic> diagnostics = reporter.getDiagnostics();
		assertEquals(4, diagnostics.size());
		assertEquals(List.of(1, 2, 3, 4), diagnostics.stream().map(Diagnostic::getLine).collect(Collectors.toList()));
	}

	@Test
	void returnInsideMainIsAllowed()
	{
		analyzeBody("d7klo (true) { d7krg3 1; } d7krg3;");

		assertEquals(List.of(), messages());
	}

	@Test
	void returnOutsideMainIsRejected()
	{
		Token keyword = new Scanner("d7krg3", reporter).scanTokens().get(0);
		SemanticAnalyzer analyzer = new SemanticAnalyzer(reporter);

		new ReturnStatement(keyword, null).accept(analyzer);

		assertEquals(List.of("return statement outside of main function"), messages());
	}

	@Test
	void erroneousSyntaxIsTypedAsError()
	{
		String source = "d7kbdaya() { d7klo (1 > ) { } }";
		Program program = new D7KParser(new Scanner(source, reporter).scanTokens(), reporter).parse();

		new SemanticAnalyzer(reporter).analyze(program);

		IfStatement ifStatement = (IfStatement) statements(program).get(0);
		assertSame(ErrorType.INSTANCE, ifStatement.getCondition().getResolvedType());
		assertEquals(1, reporter.errorCount()); // only the syntax error
	}
}
