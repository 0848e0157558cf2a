package io.github.pyanchor.analyzer.python;

/** Constants for tree-sitter-python node type and field names. */
public final class PythonNodeTypes {

    // ===== Structure =====
    public static final String MODULE = "module";
    public static final String BLOCK = "block";
    public static final String ERROR = "ERROR";
    public static final String COMMENT = "comment";
    public static final String LINE_CONTINUATION = "line_continuation";

    // ===== Simple statements =====
    public static final String EXPRESSION_STATEMENT = "expression_statement";
    public static final String ASSIGNMENT = "assignment";
    public static final String AUGMENTED_ASSIGNMENT = "augmented_assignment";
    public static final String RETURN_STATEMENT = "return_statement";
    public static final String DELETE_STATEMENT = "delete_statement";
    public static final String RAISE_STATEMENT = "raise_statement";
    public static final String PASS_STATEMENT = "pass_statement";
    public static final String BREAK_STATEMENT = "break_statement";
    public static final String CONTINUE_STATEMENT = "continue_statement";
    public static final String ASSERT_STATEMENT = "assert_statement";
    public static final String GLOBAL_STATEMENT = "global_statement";
    public static final String NONLOCAL_STATEMENT = "nonlocal_statement";
    public static final String TYPE_ALIAS_STATEMENT = "type_alias_statement";
    public static final String PRINT_STATEMENT = "print_statement";
    public static final String CHEVRON = "chevron";
    public static final String EXEC_STATEMENT = "exec_statement";

    // ===== Imports =====
    public static final String IMPORT_STATEMENT = "import_statement";
    public static final String IMPORT_FROM_STATEMENT = "import_from_statement";
    public static final String FUTURE_IMPORT_STATEMENT = "future_import_statement";
    public static final String ALIASED_IMPORT = "aliased_import";
    public static final String DOTTED_NAME = "dotted_name";
    public static final String RELATIVE_IMPORT = "relative_import";
    public static final String IMPORT_PREFIX = "import_prefix";
    public static final String WILDCARD_IMPORT = "wildcard_import";

    // ===== Compound statements =====
    public static final String IF_STATEMENT = "if_statement";
    public static final String ELIF_CLAUSE = "elif_clause";
    public static final String ELSE_CLAUSE = "else_clause";
    public static final String FOR_STATEMENT = "for_statement";
    public static final String WHILE_STATEMENT = "while_statement";
    public static final String TRY_STATEMENT = "try_statement";
    public static final String EXCEPT_CLAUSE = "except_clause";
    public static final String EXCEPT_GROUP_CLAUSE = "except_group_clause";
    public static final String FINALLY_CLAUSE = "finally_clause";
    public static final String WITH_STATEMENT = "with_statement";
    public static final String WITH_CLAUSE = "with_clause";
    public static final String WITH_ITEM = "with_item";
    public static final String MATCH_STATEMENT = "match_statement";
    public static final String CASE_CLAUSE = "case_clause";

    // ===== Definitions =====
    public static final String FUNCTION_DEFINITION = "function_definition";
    public static final String CLASS_DEFINITION = "class_definition";
    public static final String DECORATED_DEFINITION = "decorated_definition";
    public static final String DECORATOR = "decorator";
    public static final String LAMBDA = "lambda";
    public static final String PARAMETERS = "parameters";
    public static final String LAMBDA_PARAMETERS = "lambda_parameters";
    public static final String TYPED_PARAMETER = "typed_parameter";
    public static final String DEFAULT_PARAMETER = "default_parameter";
    public static final String TYPED_DEFAULT_PARAMETER = "typed_default_parameter";
    public static final String LIST_SPLAT_PATTERN = "list_splat_pattern";
    public static final String DICTIONARY_SPLAT_PATTERN = "dictionary_splat_pattern";
    public static final String KEYWORD_SEPARATOR = "keyword_separator";
    public static final String POSITIONAL_SEPARATOR = "positional_separator";
    public static final String TYPE_PARAMETER = "type_parameter";
    public static final String TYPE = "type";
    public static final String MEMBER_TYPE = "member_type";

    // ===== Patterns =====
    public static final String PATTERN_LIST = "pattern_list";
    public static final String TUPLE_PATTERN = "tuple_pattern";
    public static final String LIST_PATTERN = "list_pattern";
    public static final String AS_PATTERN = "as_pattern";
    public static final String AS_PATTERN_TARGET = "as_pattern_target";
    public static final String CASE_PATTERN = "case_pattern";
    public static final String CLASS_PATTERN = "class_pattern";
    public static final String KEYWORD_PATTERN = "keyword_pattern";
    public static final String SPLAT_PATTERN = "splat_pattern";
    public static final String DICT_PATTERN = "dict_pattern";
    public static final String UNION_PATTERN = "union_pattern";

    // ===== Expressions =====
    public static final String IDENTIFIER = "identifier";
    public static final String KEYWORD_IDENTIFIER = "keyword_identifier";
    public static final String ATTRIBUTE = "attribute";
    public static final String SUBSCRIPT = "subscript";
    public static final String SLICE = "slice";
    public static final String CALL = "call";
    public static final String ARGUMENT_LIST = "argument_list";
    public static final String KEYWORD_ARGUMENT = "keyword_argument";
    public static final String LIST_SPLAT = "list_splat";
    public static final String DICTIONARY_SPLAT = "dictionary_splat";
    public static final String PARENTHESIZED_LIST_SPLAT = "parenthesized_list_splat";
    public static final String BINARY_OPERATOR = "binary_operator";
    public static final String BOOLEAN_OPERATOR = "boolean_operator";
    public static final String NOT_OPERATOR = "not_operator";
    public static final String UNARY_OPERATOR = "unary_operator";
    public static final String COMPARISON_OPERATOR = "comparison_operator";
    public static final String CONDITIONAL_EXPRESSION = "conditional_expression";
    public static final String NAMED_EXPRESSION = "named_expression";
    public static final String PARENTHESIZED_EXPRESSION = "parenthesized_expression";
    public static final String EXPRESSION_LIST = "expression_list";
    public static final String AWAIT = "await";
    public static final String YIELD = "yield";
    public static final String TUPLE = "tuple";
    public static final String LIST = "list";
    public static final String SET = "set";
    public static final String DICTIONARY = "dictionary";
    public static final String PAIR = "pair";

    // ===== Comprehensions =====
    public static final String LIST_COMPREHENSION = "list_comprehension";
    public static final String SET_COMPREHENSION = "set_comprehension";
    public static final String DICTIONARY_COMPREHENSION = "dictionary_comprehension";
    public static final String GENERATOR_EXPRESSION = "generator_expression";
    public static final String FOR_IN_CLAUSE = "for_in_clause";
    public static final String IF_CLAUSE = "if_clause";

    // ===== Literals =====
    public static final String STRING = "string";
    public static final String CONCATENATED_STRING = "concatenated_string";
    public static final String INTERPOLATION = "interpolation";
    public static final String FORMAT_SPECIFIER = "format_specifier";
    public static final String FORMAT_EXPRESSION = "format_expression";
    public static final String INTEGER = "integer";
    public static final String FLOAT = "float";
    public static final String TRUE = "true";
    public static final String FALSE = "false";
    public static final String NONE = "none";
    public static final String ELLIPSIS = "ellipsis";

    // ===== Field names =====
    public static final String FIELD_NAME = "name";
    public static final String FIELD_ALIAS = "alias";
    public static final String FIELD_BODY = "body";
    public static final String FIELD_LEFT = "left";
    public static final String FIELD_RIGHT = "right";
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_OPERATOR = "operator";
    public static final String FIELD_OPERATORS = "operators";
    public static final String FIELD_ARGUMENT = "argument";
    public static final String FIELD_ARGUMENTS = "arguments";
    public static final String FIELD_FUNCTION = "function";
    public static final String FIELD_OBJECT = "object";
    public static final String FIELD_ATTRIBUTE = "attribute";
    public static final String FIELD_SUBSCRIPT = "subscript";
    public static final String FIELD_CONDITION = "condition";
    public static final String FIELD_CONSEQUENCE = "consequence";
    public static final String FIELD_ALTERNATIVE = "alternative";
    public static final String FIELD_PARAMETERS = "parameters";
    public static final String FIELD_RETURN_TYPE = "return_type";
    public static final String FIELD_SUPERCLASSES = "superclasses";
    public static final String FIELD_TYPE_PARAMETERS = "type_parameters";
    public static final String FIELD_DEFINITION = "definition";
    public static final String FIELD_MODULE_NAME = "module_name";
    public static final String FIELD_CAUSE = "cause";
    public static final String FIELD_KEY = "key";
    public static final String FIELD_SUBJECT = "subject";
    public static final String FIELD_GUARD = "guard";
    public static final String FIELD_CODE = "code";
    public static final String FIELD_EXPRESSION = "expression";

    private PythonNodeTypes() {}
}
