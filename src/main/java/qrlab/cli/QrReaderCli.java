package qrlab.cli;

import qrlab.config.QrLabConfig;
import qrlab.content.ContentClassifier;
import qrlab.content.ContentType;
import qrlab.content.WifiConfig;
import qrlab.decode.DecodePipeline;
import qrlab.decode.DecodeStatus;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Decodes QR codes in image files and prints their content.
 *
 * <pre>
 * java -cp qrlab.jar qrlab.cli.QrReaderCli photo.jpg [more.png ...]
 * </pre>
 *
 * Exit status is 0 when every file held at least one QR code, 1 otherwise.
 */
public class QrReaderCli {

    private static final Map<ContentType, String> TYPE_LABELS = Map.of(
            ContentType.URL, "URL",
            ContentType.EMAIL, "Email",
            ContentType.PHONE, "Phone",
            ContentType.WIFI, "WiFi Configuration",
            ContentType.SMS, "SMS",
            ContentType.VCARD, "vCard",
            ContentType.GEO, "Geo Location",
            ContentType.TEXT, "Text"
    );

    private final DecodePipeline pipeline;
    private final long maxFileBytes;
    private final PrintStream out;

    QrReaderCli(DecodePipeline pipeline, long maxFileBytes, PrintStream out) {
        this.pipeline = pipeline;
        this.maxFileBytes = maxFileBytes;
        this.out = out;
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            System.out.println("Usage: QrReaderCli <image_path> [image_path ...]");
            System.out.println();
            System.out.println("Example:");
            System.out.println("  QrReaderCli qr_code.png");
            System.out.println("  QrReaderCli /path/to/image.jpg");
            System.exit(1);
        }
        var config = QrLabConfig.load();
        var cli = new QrReaderCli(DecodePipeline.create(config), config.maxUploadBytes(), System.out);
        System.exit(cli.run(Arrays.asList(args)));
    }

    int run(List<String> paths) {
        int failures = 0;
        for (var path : paths) {
            if (!read(Path.of(path))) {
                failures++;
            }
        }
        return failures == 0 ? 0 : 1;
    }

    private boolean read(Path path) {
        if (!Files.isRegularFile(path)) {
            out.println("Error: File '" + path + "' not found.");
            return false;
        }
        byte[] bytes;
        try {
            if (Files.size(path) > maxFileBytes) {
                out.println("Error: File '" + path + "' is larger than " + maxFileBytes + " bytes.");
                return false;
            }
            bytes = Files.readAllBytes(path);
        } catch (IOException e) {
            out.println("Error: Could not read the image file '" + path + "'.");
            return false;
        }

        var result = pipeline.decode(bytes);
        if (result.status() == DecodeStatus.UNREADABLE) {
            out.println("Error: Could not read the image file '" + path + "'.");
            out.println("Supported formats: PNG, JPG, JPEG, GIF, BMP");
            return false;
        }
        if (!result.isSuccess()) {
            out.println(result.errorMessage());
            return false;
        }

        out.println("Found " + result.symbols().size() + " QR code(s) in '" + path + "':");
        for (var symbol : result.symbols()) {
            out.println("-".repeat(50));
            out.println("Content: " + symbol.text());
            var info = ContentClassifier.classify(symbol.text());
            out.println("Type: " + TYPE_LABELS.get(info.type()));
            info.wifi().ifPresent(this::printWifi);
        }
        return true;
    }

    private void printWifi(WifiConfig wifi) {
        if (wifi.fields().isEmpty()) {
            return;
        }
        out.println("WiFi Details:");
        wifi.ssid().ifPresent(v -> out.println("  Network Name (SSID): " + v));
        wifi.security().ifPresent(v -> out.println("  Security Type: " + v));
        wifi.password().ifPresent(v -> out.println("  Password: " + v));
        wifi.hidden().ifPresent(v -> out.println("  Hidden: " + v));
    }
}
