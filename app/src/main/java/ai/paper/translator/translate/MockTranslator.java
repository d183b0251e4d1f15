package ai.paper.translator.translate;

/**
 * Translator used for offline runs; prefixes every source line with a marker.
 */
public class MockTranslator implements ChunkTranslator {

    static final String PREFIX = "[MOCK] ";

    @Override
    public String translate(TranslationRequest request) {
        String[] lines = request.chunkText().split("\\R", -1);
        StringBuilder result = new StringBuilder(request.chunkText().length() + lines.length * PREFIX.length());
        for (int i = 0; i < lines.length; i++) {
            if (i == lines.length - 1 && lines[i].isEmpty()) {
                break;
            }
            if (i > 0) {
                result.append('\n');
            }
            result.append(PREFIX).append(lines[i]);
        }
        return result.toString();
    }
}
