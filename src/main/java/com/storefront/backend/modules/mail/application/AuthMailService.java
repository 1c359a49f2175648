package com.storefront.backend.modules.mail.application;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Outbound mail for the account lifecycle. Both operations throw {@link MailDispatchException}
 * when the transport fails; callers decide whether that is fatal.
 */
@Service
public class AuthMailService {

    private static final Logger log = LoggerFactory.getLogger(AuthMailService.class);

    private final JavaMailSender mailSender;
    private final String fromAddress;
    private final String verificationUrl;
    private final String resetPasswordUrl;

    public AuthMailService(
            JavaMailSender mailSender,
            @Value("${app.mail.from:no-reply@storefront.local}") String fromAddress,
            @Value("${app.mail.verification-url:http://localhost:8080/auth/verify-email}") String verificationUrl,
            @Value("${app.mail.reset-password-url:http://localhost:8080/auth/verify-reset}") String resetPasswordUrl
    ) {
        this.mailSender = mailSender;
        this.fromAddress = fromAddress;
        this.verificationUrl = verificationUrl;
        this.resetPasswordUrl = resetPasswordUrl;
    }

    public void sendVerification(String email, String rawToken) {
        String link = withToken(verificationUrl, rawToken);
        String body = """
                Welcome!

                Confirm your email address by opening the link below:
                %s

                The link is valid for one hour. If you did not sign up, you can ignore this message.
                """.formatted(link);
        send(email, "Verify your email", body);
    }

    public void sendPasswordReset(String email, String rawToken) {
        String link = withToken(resetPasswordUrl, rawToken);
        String body = """
                We received a request to reset your password.

                Choose a new password here:
                %s

                The link is valid for 15 minutes. If you did not request a reset, you can ignore this message.
                """.formatted(link);
        send(email, "Reset your password", body);
    }

    private void send(String to, String subject, String body) {
        SimpleMailMessage message = new SimpleMailMessage();
        message.setFrom(fromAddress);
        message.setTo(to);
        message.setSubject(subject);
        message.setText(body);
        try {
            mailSender.send(message);
            log.info("Mail '{}' sent to {}", subject, to);
        } catch (MailException ex) {
            log.error("Failed to send mail '{}' to {}", subject, to, ex);
            throw new MailDispatchException("Could not deliver mail: " + subject, ex);
        }
    }

    private String withToken(String baseUrl, String rawToken) {
        return UriComponentsBuilder.fromUriString(baseUrl)
                .queryParam("token", rawToken)
                .build()
                .toUriString();
    }
}
