package com.ledgerly.backend.services.documents.extraction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import org.junit.jupiter.api.Test;

class MerchantExtractorTest {

    @Test
    void stripsOperationPrefixesAndInstallments() {
        assertEquals("CARREFOUR", MerchantExtractor.extract("Compra CARREFOUR cuota 2 de 6"));
        assertEquals("NETFLIX SUSCRIPCION", MerchantExtractor.extract("NETFLIX SUSCRIPCION"));
        assertEquals("Juan Perez", MerchantExtractor.extract("Transferencia Juan Perez - CBU 0000003100"));
        assertEquals("Spotify", MerchantExtractor.extract("Débito Spotify"));
    }

    @Test
    void reversalsKeepTheMerchant() {
        assertEquals("MERCADOLIBRE", MerchantExtractor.extract("Reverso - MERCADOLIBRE"));
    }

    @Test
    void truncatesAndHandlesBlank() {
        assertEquals(100, MerchantExtractor.extract("X".repeat(150)).length());
        assertNull(MerchantExtractor.extract("  "));
        assertNull(MerchantExtractor.extract(null));
    }
}
