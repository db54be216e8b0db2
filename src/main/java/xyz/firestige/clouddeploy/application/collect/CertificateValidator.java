package xyz.firestige.clouddeploy.application.collect;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.clouddeploy.domain.session.CancellationToken;
import xyz.firestige.clouddeploy.domain.shared.validation.ValidationResult;
import xyz.firestige.clouddeploy.infrastructure.process.CommandSpec;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessResult;
import xyz.firestige.clouddeploy.infrastructure.process.ProcessRunner;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Duration;
import java.util.Base64;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 自带证书校验：PEM 可解析、私钥与证书公钥匹配、证书在有效期内。
 * 私钥支持 PKCS#8 与 PKCS#1(RSA)；SEC1 EC 私钥需借助 openssl 转换。
 */
public class CertificateValidator {

    private static final Logger log = LoggerFactory.getLogger(CertificateValidator.class);

    private static final Pattern PEM_BLOCK = Pattern.compile(
            "-----BEGIN ([A-Z ]+)-----\\s*([A-Za-z0-9+/=\\s]+?)\\s*-----END \\1-----");
    private static final byte[] RSA_ALGORITHM_IDENTIFIER = {
            0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48, (byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00
    };

    private final ProcessRunner runner;

    public CertificateValidator(ProcessRunner runner) {
        this.runner = runner;
    }

    public ValidationResult validate(Path certificatePath, Path privateKeyPath, CancellationToken token) {
        X509Certificate certificate;
        try {
            certificate = readCertificate(certificatePath);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            return ValidationResult.failure("Cannot read certificate " + certificatePath + ": " + e.getMessage());
        }
        try {
            certificate.checkValidity();
        } catch (CertificateExpiredException e) {
            return ValidationResult.failure("Certificate expired on " + certificate.getNotAfter());
        } catch (CertificateNotYetValidException e) {
            return ValidationResult.failure("Certificate is not valid before " + certificate.getNotBefore());
        }
        PrivateKey key;
        try {
            key = readPrivateKey(privateKeyPath, token);
        } catch (IOException | GeneralSecurityException | IllegalArgumentException e) {
            return ValidationResult.failure("Cannot read private key " + privateKeyPath + ": " + e.getMessage());
        }
        try {
            if (!matches(certificate, key)) {
                return ValidationResult.failure("Private key does not match the certificate");
            }
        } catch (GeneralSecurityException e) {
            return ValidationResult.failure("Cannot verify key pair: " + e.getMessage());
        }
        log.info("证书校验通过: subject={}, notAfter={}", certificate.getSubjectX500Principal(), certificate.getNotAfter());
        return ValidationResult.success();
    }

    X509Certificate readCertificate(Path path) throws IOException, GeneralSecurityException {
        PemBlock block = firstBlock(Files.readString(path, StandardCharsets.US_ASCII), "CERTIFICATE");
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(block.der()));
    }

    PrivateKey readPrivateKey(Path path, CancellationToken token) throws IOException, GeneralSecurityException {
        String pem = Files.readString(path, StandardCharsets.US_ASCII);
        PemBlock block = firstBlock(pem, null);
        switch (block.type()) {
            case "PRIVATE KEY":
                return decodePkcs8(block.der());
            case "RSA PRIVATE KEY":
                return KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(wrapPkcs1(block.der())));
            case "EC PRIVATE KEY":
                return decodePkcs8(firstBlock(convertSec1(pem, token), "PRIVATE KEY").der());
            case "ENCRYPTED PRIVATE KEY":
                throw new IllegalArgumentException("encrypted private keys are not supported, decrypt the key first");
            default:
                throw new IllegalArgumentException("unsupported PEM block '" + block.type() + "'");
        }
    }

    private PrivateKey decodePkcs8(byte[] der) throws GeneralSecurityException {
        PKCS8EncodedKeySpec spec = new PKCS8EncodedKeySpec(der);
        try {
            return KeyFactory.getInstance("RSA").generatePrivate(spec);
        } catch (GeneralSecurityException e) {
            return KeyFactory.getInstance("EC").generatePrivate(spec);
        }
    }

    private String convertSec1(String pem, CancellationToken token) {
        CommandSpec spec = CommandSpec.of("openssl", "pkcs8", "-topk8", "-nocrypt")
                .stdin(pem)
                .timeout(Duration.ofSeconds(30))
                .build();
        ProcessResult result = runner.run(spec, token);
        if (result.notFound()) {
            throw new IllegalArgumentException("SEC1 EC keys need openssl to convert, or supply a PKCS#8 key");
        }
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("openssl could not convert the EC key: " + result.stderr().strip());
        }
        return result.stdout();
    }

    private boolean matches(X509Certificate certificate, PrivateKey key) throws GeneralSecurityException {
        String algorithm = switch (key.getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC" -> "SHA256withECDSA";
            default -> throw new GeneralSecurityException("unsupported key algorithm " + key.getAlgorithm());
        };
        if (!certificate.getPublicKey().getAlgorithm().equals(key.getAlgorithm())) {
            return false;
        }
        byte[] challenge = new byte[64];
        new SecureRandom().nextBytes(challenge);
        Signature signer = Signature.getInstance(algorithm);
        signer.initSign(key);
        signer.update(challenge);
        byte[] signature = signer.sign();
        Signature verifier = Signature.getInstance(algorithm);
        verifier.initVerify(certificate.getPublicKey());
        verifier.update(challenge);
        return verifier.verify(signature);
    }

    private static PemBlock firstBlock(String pem, String expectedType) {
        Matcher m = PEM_BLOCK.matcher(pem);
        while (m.find()) {
            if (expectedType == null || expectedType.equals(m.group(1))) {
                byte[] der = Base64.getMimeDecoder().decode(m.group(2));
                return new PemBlock(m.group(1), der);
            }
        }
        throw new IllegalArgumentException("no " + (expectedType == null ? "PEM" : expectedType) + " block found");
    }

    /**
     * PKCS#1 RSAPrivateKey 包装为 PKCS#8 PrivateKeyInfo
     */
    static byte[] wrapPkcs1(byte[] pkcs1) {
        ByteArrayOutputStream body = new ByteArrayOutputStream();
        body.write(0x02);
        body.write(0x01);
        body.write(0x00);
        body.writeBytes(RSA_ALGORITHM_IDENTIFIER);
        body.write(0x04);
        writeLength(body, pkcs1.length);
        body.writeBytes(pkcs1);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        out.write(0x30);
        writeLength(out, body.size());
        out.writeBytes(body.toByteArray());
        return out.toByteArray();
    }

    private static void writeLength(ByteArrayOutputStream out, int length) {
        if (length < 0x80) {
            out.write(length);
        } else if (length <= 0xff) {
            out.write(0x81);
            out.write(length);
        } else if (length <= 0xffff) {
            out.write(0x82);
            out.write(length >> 8);
            out.write(length & 0xff);
        } else {
            out.write(0x83);
            out.write(length >> 16);
            out.write((length >> 8) & 0xff);
            out.write(length & 0xff);
        }
    }

    private record PemBlock(String type, byte[] der) {
    }
}
