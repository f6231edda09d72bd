package com.seveninterprise.stackforge.services;

import org.yaml.snakeyaml.nodes.Tag;
import org.yaml.snakeyaml.resolver.Resolver;

import java.util.regex.Pattern;

/**
 * Resolver com os tipos implícitos do core schema do YAML 1.2, o mesmo que o
 * Docker Compose usa ao ler o arquivo.
 *
 * Diferenças em relação ao resolver padrão (YAML 1.1) do SnakeYAML:
 * - yes/no/on/off continuam strings
 * - 22:22 não é número sexagesimal
 * - 2024-01-01 não vira timestamp
 * - inteiros com zero à esquerda, octais e hexadecimais ficam como string,
 *   preservando o texto original
 *
 * Usado tanto na leitura quanto na escrita, para que strings como "yes" sejam
 * gravadas sem aspas e números em string (ex: '8080') continuem com aspas.
 */
public class ComposeYamlResolver extends Resolver {

    public static final Pattern CORE_BOOL = Pattern.compile("^(?:true|True|TRUE|false|False|FALSE)$");

    public static final Pattern CORE_INT = Pattern.compile("^[-+]?(?:0|[1-9][0-9]*)$");

    public static final Pattern CORE_FLOAT = Pattern.compile(
        "^[-+]?(?:\\.[0-9]+|[0-9]+\\.[0-9]*)(?:[eE][-+]?[0-9]+)?$"
            + "|^[-+]?[0-9]+[eE][-+]?[0-9]+$"
            + "|^[-+]?\\.(?:inf|Inf|INF)$"
            + "|^\\.(?:nan|NaN|NAN)$");

    public static final Pattern CORE_NULL = Pattern.compile("^(?:~|null|Null|NULL)$");

    @Override
    protected void addImplicitResolvers() {
        addImplicitResolver(Tag.BOOL, CORE_BOOL, "tTfF");
        // INT antes de FLOAT: "10" deve ser inteiro
        addImplicitResolver(Tag.INT, CORE_INT, "-+0123456789");
        addImplicitResolver(Tag.FLOAT, CORE_FLOAT, "-+0123456789.");
        addImplicitResolver(Tag.MERGE, MERGE, "<");
        addImplicitResolver(Tag.NULL, CORE_NULL, "~nN\0");
        addImplicitResolver(Tag.NULL, EMPTY, null);
    }
}
