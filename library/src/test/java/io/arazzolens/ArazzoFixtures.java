package io.arazzolens;

import io.arazzolens.core.model.ArazzoDocument;
import io.arazzolens.infrastructure.parsing.ArazzoModelBuilder;
import io.arazzolens.infrastructure.parsing.ModelBuildResult;
import io.arazzolens.infrastructure.parsing.RangedNodeReader;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Objects;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class ArazzoFixtures {

    public static final String MINIMAL = "/arazzo/minimal.arazzo.yaml";
    public static final String PET_PURCHASE = "/arazzo/pet-purchase.arazzo.yaml";
    public static final String PET_PURCHASE_JSON = "/arazzo/pet-purchase.arazzo.json";
    public static final String ORDER_WITH_RETRIES = "/arazzo/order-with-retries.arazzo.yaml";

    public static String read(final String resource) {
        try (final InputStream resourceAsStream = ArazzoFixtures.class.getResourceAsStream(resource)) {
            return new String(Objects.requireNonNull(resourceAsStream, resource).readAllBytes(), UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ModelBuildResult build(final String content) {
        return new ArazzoModelBuilder().build(new RangedNodeReader().read(content).getRoot());
    }

    public static ArazzoDocument document(final String content) {
        return build(content).getDocument();
    }

    private ArazzoFixtures() {}
}
