package ai.scripture.translator.cli;

import ai.scripture.translator.config.TranslationProvider;
import picocli.CommandLine;

public class TranslationProviderConverter implements CommandLine.ITypeConverter<TranslationProvider> {

    @Override
    public TranslationProvider convert(String value) {
        return TranslationProvider.from(value);
    }
}
