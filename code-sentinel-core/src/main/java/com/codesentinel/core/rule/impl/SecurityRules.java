package com.codesentinel.core.rule.impl;

import com.codesentinel.core.model.Category;
import com.codesentinel.core.model.Severity;
import com.codesentinel.core.rule.Rule;
import com.codesentinel.core.rule.base.AbstractRuleProvider;

import java.util.List;

/**
 * Security rules: injection, hardcoded secrets, weak cryptography, unsafe
 * deserialization and insecure transport settings.
 *
 * <p>All security rules are pattern rules over the raw line, so string contents
 * (where secrets and queries live) are visible to them.
 *
 * <p>Rules that look for a call followed by something later on the line are anchored
 * at the line start and lock onto the first call with an atomic group, and their
 * repeated parts are possessive. A line is then searched in time linear in its length,
 * however many call prefixes, quotes or {@code +} signs it contains.
 *
 * @since 1.0.0
 */
public class SecurityRules extends AbstractRuleProvider {

    @Override
    public String getId() {
        return "security-rules";
    }

    @Override
    public String getDisplayName() {
        return "Security Rules";
    }

    @Override
    public Category getCategory() {
        return Category.SECURITY;
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    protected List<Rule> defineRules() {
        return List.of(
            pattern("sql-injection", Severity.CRITICAL,
                "^(?>.*?execute\\s*\\(\\s*[\"']).*[\"']\\s*(%|\\+)",
                "CWE-89",
                "SQL Injection vulnerability detected: query built with '{1}'",
                "Use parameterized queries: cursor.execute(\"SELECT * FROM users WHERE id = ?\", (user_id,))"),
            pattern("sql-fstring-query", Severity.CRITICAL,
                "execute\\s*\\(\\s*f[\"']",
                "CWE-89",
                "SQL query built with an f-string",
                "Use parameterized queries instead of f-string interpolation"),
            pattern("command-injection", Severity.CRITICAL,
                "^(?>.*?(os\\.system|subprocess\\.(?:call|run|Popen|check_output))\\()[^+]*+\\+.*\\)",
                "CWE-78",
                "Command Injection vulnerability in {1}()",
                "Use subprocess with list arguments: subprocess.run([\"command\", arg1, arg2])"),
            pattern("shell-true", Severity.ERROR,
                "^(?>.*?subprocess\\.\\w+\\().*\\bshell\\s*=\\s*True",
                "CWE-78",
                "Subprocess invoked with shell=True",
                "Pass the command as a list and remove shell=True"),
            pattern("hardcoded-credentials", Severity.CRITICAL,
                "(?i)\\b(?=[a-z0-9_]*?(?:password|passwd|pwd|secret|token|api_key))([a-z0-9_]++)\\s*=\\s*([\"'])([^\"']+)\\2",
                "CWE-798",
                "Hardcoded credentials detected in '{1}'",
                "{1} = os.getenv(\"{1:upper}\")"),
            pattern("weak-cryptography", Severity.WARNING,
                "(?i)\\b(md5|sha1)\\b",
                "CWE-327",
                "Weak cryptographic algorithm: {1:lower}",
                "Use SHA-256 or better: hashlib.sha256(data.encode())"),
            pattern("dangerous-eval", Severity.CRITICAL,
                "\\b(eval|exec)\\s*\\(",
                "CWE-95",
                "Dangerous {1}() usage",
                "Use ast.literal_eval() for safe evaluation or parse manually"),
            pattern("unsafe-deserialization", Severity.WARNING,
                "\\b(pickle|cPickle|marshal|dill)\\.loads?\\s*\\(",
                "CWE-502",
                "Unsafe deserialization with {1}",
                "Use json.loads() for untrusted data"),
            pattern("unsafe-yaml-load", Severity.ERROR,
                "\\byaml\\.load\\s*\\(([^,()]*+(?:\\([^()]*+\\))?[^,()]*+)\\)",
                "CWE-502",
                "yaml.load() without a safe loader",
                "yaml.safe_load({1})"),
            pattern("tls-verification-disabled", Severity.ERROR,
                "\\bverify\\s*=\\s*False\\b",
                "CWE-295",
                "TLS certificate verification disabled",
                "Remove verify=False so certificates are validated"),
            pattern("debug-enabled", Severity.WARNING,
                "\\b(DEBUG|debug)\\s*=\\s*True\\b",
                "CWE-489",
                "Debug mode enabled",
                "{1} = os.getenv(\"DEBUG\", \"false\").lower() == \"true\""),
            pattern("cleartext-http", Severity.INFO,
                "([\"'])http://(?!localhost|127\\.0\\.0\\.1)([^\"'\\s]+)",
                "CWE-319",
                "Cleartext HTTP URL: http://{2}",
                "{1}https://{2}{1}")
        );
    }
}
