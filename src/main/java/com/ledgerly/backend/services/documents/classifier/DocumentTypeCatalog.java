package com.ledgerly.backend.services.documents.classifier;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Catálogo versionado de tipos de documento e seus padrões de detecção.
 * Prioridades e padrões são dados de calibração: alterar aqui muda a classificação.
 */
public final class DocumentTypeCatalog {

    public static final String VERSION = "2024.1";

    private static final int CI = Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;

    public record DocumentTypeGroup(String id, String name, String fullName, int priority, List<Pattern> patterns) {}

    public static final List<DocumentTypeGroup> GROUPS = List.of(
            new DocumentTypeGroup("vep", "VEP", "Volante Electrónico de Pago", 100, List.of(
                    Pattern.compile("volante\\s+electr[oó]nico\\s+de\\s+pago", CI),
                    Pattern.compile("\\bVEP\\b"),
                    Pattern.compile("Nro\\.\\s*VEP", CI),
                    Pattern.compile("ARCA.*VEP|VEP.*ARCA", CI))),
            new DocumentTypeGroup("bank_statement", "Extracto Bancario", "Extracto de Cuenta Bancaria", 80, List.of(
                    Pattern.compile("movimientos?\\s+del", CI),
                    Pattern.compile("extracto\\s+(?:de\\s+)?(?:cuenta|bancario)", CI),
                    Pattern.compile("estado\\s+de\\s+cuenta", CI),
                    Pattern.compile("resumen\\s+de\\s+(?:cuenta|movimientos)", CI),
                    Pattern.compile("saldo\\s+(?:inicial|final|en\\s+\\$)", CI),
                    // número de conta no formato "CTE $ ****7982"
                    Pattern.compile("CTE\\s*\\$\\s*\\*+\\d+", CI),
                    Pattern.compile("caja\\s+de\\s+ahorro", CI),
                    Pattern.compile("cuenta\\s+corriente", CI))),
            new DocumentTypeGroup("credit_card_statement", "Resumen Tarjeta", "Resumen de Tarjeta de Crédito", 85, List.of(
                    Pattern.compile("resumen\\s+(?:de\\s+)?tarjeta", CI),
                    Pattern.compile("ciclo\\s+de\\s+facturaci[oó]n", CI),
                    Pattern.compile("tarjeta\\s+(?:de\\s+)?cr[eé]dito", CI),
                    Pattern.compile("vencimiento\\s+(?:m[ií]nimo|total)", CI),
                    Pattern.compile("pago\\s+m[ií]nimo", CI),
                    Pattern.compile("l[ií]mite\\s+de\\s+(?:compra|cr[eé]dito)", CI))),
            new DocumentTypeGroup("invoice", "Factura", "Factura", 90, List.of(
                    Pattern.compile("factura\\s*(?:tipo\\s*)?[abc]", CI),
                    Pattern.compile("factura\\s+(?:electr[oó]nica|original)", CI),
                    Pattern.compile("comprobante\\s+(?:tipo|original)", CI),
                    Pattern.compile("(?:C\\.?U\\.?I\\.?T\\.?|CUIT)\\s*:?\\s*\\d{2}-?\\d{8}-?\\d", CI),
                    Pattern.compile("(?:punto\\s+de\\s+venta|pto\\.\\s*vta)", CI),
                    Pattern.compile("n[uú]mero\\s+de\\s+comprobante", CI),
                    Pattern.compile("importe\\s+(?:neto|total|iva)", CI),
                    Pattern.compile("I\\.?V\\.?A\\.?\\s+(?:\\d+(?:[.,]\\d+)?%|\\(\\d+(?:[.,]\\d+)?%\\))", CI))),
            new DocumentTypeGroup("receipt", "Recibo", "Recibo de Pago", 70, List.of(
                    Pattern.compile("recibo\\s+(?:de\\s+)?(?:pago|cobro)", CI),
                    Pattern.compile("comprobante\\s+de\\s+pago", CI),
                    Pattern.compile("recib[ií]\\s+de\\s+conformidad", CI),
                    Pattern.compile("pago\\s+recibido", CI))),
            new DocumentTypeGroup("payment_voucher", "Comprobante de Pago", "Comprobante de Transferencia/Pago", 75, List.of(
                    Pattern.compile("comprobante\\s+de\\s+transferencia", CI),
                    Pattern.compile("transferencia\\s+(?:exitosa|realizada)", CI),
                    Pattern.compile("operaci[oó]n\\s+(?:exitosa|n[uú]mero)", CI),
                    Pattern.compile("n[uú]mero\\s+de\\s+operaci[oó]n", CI),
                    Pattern.compile("CVU|CBU", CI))),
            new DocumentTypeGroup("subscription", "Suscripción", "Factura de Suscripción/Servicio", 65, List.of(
                    Pattern.compile("suscripci[oó]n", CI),
                    Pattern.compile("per[ií]odo\\s+(?:de\\s+)?facturaci[oó]n", CI),
                    Pattern.compile("servicio\\s+(?:mensual|anual)", CI),
                    Pattern.compile("renovaci[oó]n\\s+autom[aá]tica", CI),
                    Pattern.compile("plan\\s+(?:b[aá]sico|premium|pro)", CI))),
            new DocumentTypeGroup("utility_bill", "Servicio", "Factura de Servicios", 60, List.of(
                    Pattern.compile("(?:edenor|edesur|metrogas|aysa|telecom|movistar|personal|claro)", CI),
                    Pattern.compile("consumo\\s+(?:del\\s+)?per[ií]odo", CI),
                    Pattern.compile("lectura\\s+(?:anterior|actual)", CI),
                    Pattern.compile("kwh|m[³3]|minutos", CI))));

    public static final String UNKNOWN_NAME = "Documento";

    private DocumentTypeCatalog() {}
}
