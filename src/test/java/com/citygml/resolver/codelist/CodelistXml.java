package com.citygml.resolver.codelist;

/**
 * Builds codelist documents in the layout published for PLATEAU datasets.
 */
public final class CodelistXml {

    private CodelistXml() {
    }

    /**
     * @param codesAndMeanings alternating code, meaning
     */
    public static String dictionary(String id, String... codesAndMeanings) {
        StringBuilder sb = new StringBuilder();
        sb.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n");
        sb.append("<gml:Dictionary xmlns:gml=\"http://www.opengis.net/gml\" gml:id=\"").append(id).append("\">\n");
        sb.append("  <gml:name>").append(id).append("</gml:name>\n");
        for (int i = 0; i + 1 < codesAndMeanings.length; i += 2) {
            sb.append("  <gml:dictionaryEntry>\n");
            sb.append("    <gml:Definition gml:id=\"id").append(i / 2 + 1).append("\">\n");
            sb.append("      <gml:description>").append(codesAndMeanings[i + 1]).append("</gml:description>\n");
            sb.append("      <gml:name>").append(codesAndMeanings[i]).append("</gml:name>\n");
            sb.append("    </gml:Definition>\n");
            sb.append("  </gml:dictionaryEntry>\n");
        }
        sb.append("</gml:Dictionary>\n");
        return sb.toString();
    }
}
