package labelbuilder.label.render;

import com.google.zxing.BarcodeFormat;

public enum BarcodeSymbology {
    CODE_128(BarcodeFormat.CODE_128),
    CODE_39(BarcodeFormat.CODE_39),
    CODE_93(BarcodeFormat.CODE_93),
    EAN_13(BarcodeFormat.EAN_13),
    EAN_8(BarcodeFormat.EAN_8),
    UPC_A(BarcodeFormat.UPC_A),
    ITF(BarcodeFormat.ITF),
    CODABAR(BarcodeFormat.CODABAR),
    QR_CODE(BarcodeFormat.QR_CODE),
    DATA_MATRIX(BarcodeFormat.DATA_MATRIX),
    PDF_417(BarcodeFormat.PDF_417);

    private final BarcodeFormat format;

    BarcodeSymbology(BarcodeFormat format) {
        this.format = format;
    }

    public BarcodeFormat getFormat() {
        return format;
    }
}
