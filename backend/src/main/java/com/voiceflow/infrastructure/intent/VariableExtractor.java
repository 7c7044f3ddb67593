package com.voiceflow.infrastructure.intent;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts variable placeholders from an utterance.
 *
 * Records the intent to bind a variable, not its spoken value: "输入用户名admin" yields
 * username → ${username}.
 */
@Component
public class VariableExtractor {

    private record Probe(String name, Pattern pattern) {}

    private static final Pattern BRACED_VARIABLE = Pattern.compile("\\{([^}]+)\\}");

    private static final List<Probe> PROBES = List.of(
            new Probe("username", compile("用户名|账号|账户名")),
            new Probe("password", compile("密码|口令")),
            new Probe("email", compile("邮箱|邮件|email")),
            new Probe("phone", compile("电话|手机|联系方式")),
            new Probe("name", compile("姓名|名字|名称")),
            new Probe("count", compile("(\\d+)条|(\\d+)个|(\\d+)项"))
    );

    public Map<String, String> extract(String text) {
        Map<String, String> variables = new LinkedHashMap<>();
        if (text == null || text.isEmpty()) {
            return variables;
        }

        Matcher m = BRACED_VARIABLE.matcher(text);
        while (m.find()) {
            String name = m.group(1);
            variables.put(name, placeholder(name));
        }

        for (Probe probe : PROBES) {
            if (probe.pattern().matcher(text).find()) {
                variables.put(probe.name(), placeholder(probe.name()));
            }
        }

        return variables;
    }

    static String placeholder(String name) {
        return "${" + name + "}";
    }

    private static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
