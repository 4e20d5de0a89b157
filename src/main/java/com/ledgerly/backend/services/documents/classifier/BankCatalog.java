package com.ledgerly.backend.services.documents.classifier;

import java.util.List;

/**
 * Lista ordenada de bancos conhecidos. A primeira palavra-chave encontrada no texto vence,
 * então a ordem importa.
 */
public final class BankCatalog {

    public record BankIdentity(String id, String name, List<String> keywords) {}

    public static final List<BankIdentity> BANKS = List.of(
            new BankIdentity("hipotecario", "Banco Hipotecario", List.of("hipotecario", "banco hipotecario")),
            new BankIdentity("santander", "Santander", List.of("santander", "banco santander")),
            new BankIdentity("galicia", "Banco Galicia", List.of("galicia", "banco galicia")),
            new BankIdentity("bbva", "BBVA", List.of("bbva", "frances")),
            new BankIdentity("macro", "Banco Macro", List.of("macro", "banco macro")),
            new BankIdentity("nacion", "Banco Nación", List.of("nacion", "banco nación", "banco de la nación")),
            new BankIdentity("provincia", "Banco Provincia", List.of("provincia", "banco provincia")),
            new BankIdentity("ciudad", "Banco Ciudad", List.of("ciudad", "banco ciudad")),
            new BankIdentity("brubank", "Brubank", List.of("brubank", "bru bank")),
            new BankIdentity("mercadopago", "Mercado Pago", List.of("mercado pago", "mercadopago")),
            new BankIdentity("uala", "Ualá", List.of("uala", "ualá")),
            new BankIdentity("naranja", "Naranja X", List.of("naranja", "naranja x")),
            new BankIdentity("icbc", "ICBC", List.of("icbc", "industrial and commercial")),
            new BankIdentity("hsbc", "HSBC", List.of("hsbc")),
            new BankIdentity("credicoop", "Credicoop", List.of("credicoop", "banco credicoop")),
            new BankIdentity("supervielle", "Supervielle", List.of("supervielle")),
            new BankIdentity("patagonia", "Banco Patagonia", List.of("patagonia", "banco patagonia")),
            new BankIdentity("comafi", "Banco Comafi", List.of("comafi")),
            new BankIdentity("itau", "Itaú", List.of("itau", "itaú")));

    private BankCatalog() {}
}
