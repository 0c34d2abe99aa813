package me.golemcore.slackops.commands;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.slackops.domain.component.CommandComponent;
import me.golemcore.slackops.domain.model.ChatEvent;
import me.golemcore.slackops.domain.model.CommandType;
import me.golemcore.slackops.infrastructure.config.BotProperties;
import me.golemcore.slackops.infrastructure.i18n.MessageService;
import me.golemcore.slackops.port.inbound.CommandContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletionStage;

/**
 * Admin command that powers a server on with a Wake-on-LAN magic packet.
 *
 * <p>
 * {@code $power on} broadcasts six {@code 0xFF} bytes followed by the target
 * MAC address repeated sixteen times. Enabled only when
 * {@code bot.commands.power.mac-address} is set.
 */
@Component
@Slf4j
public class PowerCommand implements CommandComponent {

    private static final int MAC_LENGTH = 6;
    private static final int MAC_REPETITIONS = 16;

    private final BotProperties properties;
    private final MessageService messageService;

    public PowerCommand(BotProperties properties, MessageService messageService) {
        this.properties = properties;
        this.messageService = messageService;
    }

    @Override
    public String getName() {
        return properties.getCommands().getPrefix() + "power";
    }

    @Override
    public CommandType getType() {
        return CommandType.ADMIN;
    }

    @Override
    public boolean isEnabled() {
        String mac = properties.getCommands().getPower().getMacAddress();
        return mac != null && !mac.isBlank();
    }

    @Override
    public CompletionStage<Void> handle(CommandContext context, ChatEvent event, List<String> args) {
        if (args.isEmpty()) {
            return context.reply(event, messageService.getMessage("power.usage", getName()));
        }
        String state = args.get(0).toLowerCase(Locale.ROOT);
        return switch (state) {
        case "on" -> {
            wake();
            yield context.reply(event, messageService.getMessage("power.on"));
        }
        case "off" -> context.reply(event, messageService.getMessage("power.off"));
        default -> context.reply(event, messageService.getMessage("power.unknown", args.get(0)));
        };
    }

    private void wake() {
        BotProperties.PowerCommandProperties config = properties.getCommands().getPower();
        byte[] packet = magicPacket(config.getMacAddress());
        try {
            sendPacket(packet, InetAddress.getByName(config.getBroadcastAddress()), config.getPort());
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to send wake-on-LAN packet", e);
        }
        log.info("[Power] Magic packet sent to {} via {}:{}", config.getMacAddress(), config.getBroadcastAddress(),
                config.getPort());
    }

    protected void sendPacket(byte[] payload, InetAddress address, int port) throws IOException {
        try (DatagramSocket socket = new DatagramSocket()) {
            socket.setBroadcast(true);
            socket.send(new DatagramPacket(payload, payload.length, address, port));
        }
    }

    /**
     * Builds the magic packet for a MAC written as {@code aa:bb:cc:dd:ee:ff},
     * {@code aa-bb-...} or twelve bare hex digits.
     *
     * @throws IllegalArgumentException
     *             if the address is not six hex bytes
     */
    static byte[] magicPacket(String macAddress) {
        String hex = macAddress.replace(":", "").replace("-", "");
        if (hex.length() != MAC_LENGTH * 2) {
            throw new IllegalArgumentException("Invalid MAC address: " + macAddress);
        }
        byte[] mac = HexFormat.of().parseHex(hex);

        byte[] packet = new byte[MAC_LENGTH + MAC_LENGTH * MAC_REPETITIONS];
        for (int i = 0; i < MAC_LENGTH; i++) {
            packet[i] = (byte) 0xFF;
        }
        for (int i = 0; i < MAC_REPETITIONS; i++) {
            System.arraycopy(mac, 0, packet, MAC_LENGTH + i * MAC_LENGTH, MAC_LENGTH);
        }
        return packet;
    }
}
