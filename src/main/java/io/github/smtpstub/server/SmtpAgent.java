package io.github.smtpstub.server;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.jboss.logging.Logger;

import io.github.smtpstub.capture.CaptureService;
import io.github.smtpstub.channel.SocketConnection;
import io.github.smtpstub.configs.Configs;
import io.github.smtpstub.configs.UtilConfigs;
import io.github.smtpstub.workers.SmtpWorker;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Listens for clients and runs one {@link SmtpWorker} per accepted connection.
 */
@ApplicationScoped
public class SmtpAgent {
	@Inject
	Logger logger;

	@Inject
	Configs configs;

	@Inject
	CaptureService captureService;

	static final String DEFAULT_HOSTNAME = "localhost";

	private final ExecutorService threads = Executors.newCachedThreadPool();

	private ExecutorService acceptor;

	private ServerSocket server;

	private String serviceHost;

	private String serverName;

	public synchronized void start()
	{
		if(isRunning())
		{
			return;
		}

		this.serviceHost = fetchServiceHost();
		this.serverName = fetchServerName();

		logger.infof("application.server.hostname = %s", this.serviceHost );
		logger.infof("application.server.port = %s", getPort() );
		logger.infof("application.server.name = %s", this.serverName );
		configs.contentFolder().ifPresent(f -> logger.infof("application.content-folder = %s", f));

		try {
			mountServer();
		} catch (IOException failure) {
			logger.errorf("(start) <%s> %s", failure.getClass().getName(), failure.getMessage());
			stop();
			return;
		}

		this.acceptor = Executors.newSingleThreadExecutor();
		this.acceptor.submit(this::startSmtp);
	}

	public synchronized void stop()
	{
		try {
			if(this.server != null && !this.server.isClosed()) {
				this.server.close();
			}
		} catch (IOException failure) {
			logger.warnf("[stop] %s", failure.getMessage());
		}

		if(this.acceptor != null) {
			this.acceptor.shutdown();
			this.acceptor = null;
		}
	}

	@PreDestroy
	void shutdown()
	{
		stop();
		this.threads.shutdown();
	}

	public synchronized boolean isRunning()
	{
		return this.server != null && !this.server.isClosed();
	}

	public String getServerName()
	{
		return serverName;
	}

	private String fetchServiceHost()
	{
		return configs.server().hostname()
			.or( () -> UtilConfigs.OPTIONAL_HOSTNAME )
			.orElse(DEFAULT_HOSTNAME);
	}

	private String fetchServerName()
	{
		return configs.server().name().orElse(this.serviceHost);
	}

	private Integer getPort()
	{
		return configs.server().port();
	}

	private void mountServer() throws IOException
	{
		final var address = InetAddress.getByName(this.serviceHost);

		final var socketAddress = new InetSocketAddress(address, getPort());
		final var socket = new ServerSocket();
		socket.setReuseAddress(true);
		socket.bind(socketAddress);

		this.server = socket;
	}

	private void startSmtp()
	{
		final ServerSocket listening = this.server;

		logger.infof(">>> [SMTP] started on port %s <<<", getPort());

		while (true) {
			Socket client = null;
			try {
				client = listening.accept();
			} catch (IOException failure) {
				break;
			}

			logger.trace("--- [SMTP] got new connection ---");

			this.threads.submit(
				new SmtpWorker(new SocketConnection(client), this.serverName, UUID.randomUUID())
					.setSessionConsumer(captureService)
			);
		}

		logger.trace("--- [SMTP] not accepting new connections");
	}

}
